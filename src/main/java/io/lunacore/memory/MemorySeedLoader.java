package io.lunacore.memory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.lunacore.core.InvalidInputException;
import io.lunacore.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk-loads trusted facts from a two-column CSV ({@code key,value}) as pinned memories.
 *
 * <p>Cells are normalized before storing: smart quotes become plain quotes, one layer of wrapping
 * quotes is removed, pipes become {@code "; "} and whitespace runs collapse to one space. Rows with
 * fewer than two columns, an empty key or value, or a {@code key,value} header are skipped.</p>
 */
public class MemorySeedLoader {

    private static final Logger log = LoggerFactory.getLogger(MemorySeedLoader.class);

    private final FactStore factStore;
    private final double seedScore;
    private final int nonPinnedCap;
    private final CsvMapper csvMapper;

    public MemorySeedLoader(FactStore factStore, double seedScore, int nonPinnedCap) {
        this.factStore = factStore;
        this.seedScore = seedScore;
        this.nonPinnedCap = nonPinnedCap;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    /**
     * Loads a CSV file.
     *
     * @param csvPath path to the CSV
     * @param reset   delete all existing memories before loading
     */
    public SeedResult load(Path csvPath, boolean reset) {
        if (csvPath == null || !Files.isRegularFile(csvPath)) {
            throw new InvalidInputException("Seed CSV not found: " + csvPath);
        }
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            SeedResult result = load(reader, reset);
            log.info("Seeded {} pinned memories from {} (pruned {})", result.loaded(), csvPath, result.pruned());
            return result;
        } catch (IOException e) {
            throw new StorageException("Failed to read seed CSV: " + csvPath, e);
        }
    }

    /**
     * Loads CSV content already held in memory.
     */
    public SeedResult load(String csvContent, boolean reset) {
        if (csvContent == null) {
            throw new InvalidInputException("Seed CSV content must not be null");
        }
        try (Reader reader = new StringReader(csvContent)) {
            return load(reader, reset);
        } catch (IOException e) {
            throw new StorageException("Failed to parse seed CSV", e);
        }
    }

    private SeedResult load(Reader reader, boolean reset) throws IOException {
        List<MemoryWrite> writes = parse(reader);

        if (reset) {
            factStore.deleteMemories();
        }
        int loaded = factStore.upsertBatch(writes);
        int pruned = factStore.enforceNonPinnedCap(nonPinnedCap);
        return new SeedResult(loaded, pruned);
    }

    List<MemoryWrite> parse(Reader reader) throws IOException {
        // Later rows win for a repeated key, keeping the batch free of duplicate (key, pinned) pairs.
        Map<String, MemoryWrite> byKey = new LinkedHashMap<>();
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(reader)) {
            while (rows.hasNext()) {
                String[] row = rows.next();
                if (row == null || row.length < 2) {
                    continue;
                }
                String key = clean(row[0]);
                String value = clean(row[1]);
                if (key.isEmpty() || value.isEmpty()) {
                    continue;
                }
                if (key.equalsIgnoreCase("key") && value.equalsIgnoreCase("value")) {
                    continue;
                }
                byKey.remove(key);
                byKey.put(key, MemoryWrite.pinned(key, value, seedScore));
            }
        }
        return new ArrayList<>(byKey.values());
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.strip()
                .replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'');

        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if (first == last && (first == '"' || first == '\'')) {
                s = s.substring(1, s.length() - 1).strip();
            }
        }

        s = s.replace("|", "; ");
        return String.join(" ", s.split("\\s+")).strip();
    }
}
