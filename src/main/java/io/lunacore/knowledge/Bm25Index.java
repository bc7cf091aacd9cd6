package io.lunacore.knowledge;

import io.lunacore.core.StorageException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One rebuild snapshot of the chunk corpus, held as an in-memory Lucene index scored with BM25.
 *
 * <p>The snapshot never changes after {@link #build}. Readers call {@link #tryAcquire()} before
 * searching and {@link #release()} afterwards; the publisher drops its own reference when the
 * snapshot is replaced, and the underlying reader closes once the last search finishes.</p>
 */
public final class Bm25Index {

    static final String TEXT_FIELD = "text";
    private static final String DOCUMENT_ID_FIELD = "document_id";
    private static final String SOURCE_FIELD = "source";
    private static final String SEQUENCE_NO_FIELD = "sequence_no";
    private static final String CHUNK_ID_FIELD = "chunk_id";

    // Score descending, then position inside the document, then ingestion order.
    private static final Sort RANKING = new Sort(
            SortField.FIELD_SCORE,
            new SortField(SEQUENCE_NO_FIELD, SortField.Type.INT),
            new SortField(CHUNK_ID_FIELD, SortField.Type.LONG));

    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final int size;
    private final long generation;
    private final Instant builtAt;

    private Bm25Index(DirectoryReader reader, BM25Similarity similarity, long generation, Instant builtAt) {
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(similarity);
        this.size = reader.numDocs();
        this.generation = generation;
        this.builtAt = builtAt;
    }

    public static Bm25Index build(List<IndexedChunk> chunks, double k1, double b, long generation, Instant builtAt) {
        if (!(k1 >= 0) || Double.isInfinite(k1)) {
            throw new IllegalArgumentException("k1 must be a non-negative number, got " + k1);
        }
        if (!(b >= 0 && b <= 1)) {
            throw new IllegalArgumentException("b must be within [0, 1], got " + b);
        }
        BM25Similarity similarity = new BM25Similarity((float) k1, (float) b);

        ByteBuffersDirectory directory = new ByteBuffersDirectory();
        IndexWriterConfig config = new IndexWriterConfig(ChunkAnalyzer.INSTANCE)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                .setSimilarity(similarity);
        try {
            try (IndexWriter writer = new IndexWriter(directory, config)) {
                for (IndexedChunk chunk : chunks) {
                    writer.addDocument(toDocument(chunk));
                }
                writer.commit();
            }
            return new Bm25Index(DirectoryReader.open(directory), similarity, generation, builtAt);
        } catch (IOException e) {
            throw new StorageException("Failed to build retrieval index over " + chunks.size() + " chunks", e);
        }
    }

    private static Document toDocument(IndexedChunk chunk) {
        Document doc = new Document();
        doc.add(new TextField(TEXT_FIELD, chunk.text(), Field.Store.YES));
        doc.add(new StoredField(DOCUMENT_ID_FIELD, chunk.documentId()));
        doc.add(new StoredField(SOURCE_FIELD, chunk.source()));
        doc.add(new StoredField(SEQUENCE_NO_FIELD, chunk.sequenceNo()));
        doc.add(new NumericDocValuesField(SEQUENCE_NO_FIELD, chunk.sequenceNo()));
        doc.add(new StoredField(CHUNK_ID_FIELD, chunk.chunkId()));
        doc.add(new NumericDocValuesField(CHUNK_ID_FIELD, chunk.chunkId()));
        return doc;
    }

    /**
     * Returns at most {@code k} chunks that match at least one query token with a score of at
     * least {@code minScore}. Chunks sharing no token with the query are never returned.
     */
    public List<RetrievedChunk> search(List<String> queryTokens, int k, double minScore) {
        if (k <= 0 || size == 0 || queryTokens.isEmpty()) {
            return List.of();
        }
        try {
            TopFieldDocs top = searcher.search(toQuery(queryTokens), k, RANKING, true);
            StoredFields storedFields = searcher.storedFields();
            List<RetrievedChunk> hits = new ArrayList<>(top.scoreDocs.length);
            for (ScoreDoc hit : top.scoreDocs) {
                if (!(hit.score > 0) || hit.score < minScore) {
                    continue;
                }
                Document doc = storedFields.document(hit.doc);
                hits.add(new RetrievedChunk(
                        doc.get(DOCUMENT_ID_FIELD),
                        doc.get(SOURCE_FIELD),
                        doc.getField(SEQUENCE_NO_FIELD).numericValue().intValue(),
                        doc.get(TEXT_FIELD),
                        hit.score));
            }
            return hits;
        } catch (IOException e) {
            throw new StorageException("Failed to search retrieval index", e);
        }
    }

    // A token repeated in the query counts once per occurrence.
    private static Query toQuery(List<String> queryTokens) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : queryTokens) {
            counts.merge(token, 1, Integer::sum);
        }
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int clauses = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (clauses++ == IndexSearcher.getMaxClauseCount()) {
                break;
            }
            Query term = new TermQuery(new Term(TEXT_FIELD, entry.getKey()));
            if (entry.getValue() > 1) {
                term = new BoostQuery(term, entry.getValue());
            }
            builder.add(term, BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }

    boolean tryAcquire() {
        return reader.tryIncRef();
    }

    void release() {
        try {
            reader.decRef();
        } catch (IOException e) {
            throw new StorageException("Failed to close retrieval index snapshot", e);
        }
    }

    public int size() {
        return size;
    }

    public long generation() {
        return generation;
    }

    public Instant builtAt() {
        return builtAt;
    }
}
