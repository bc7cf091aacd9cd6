package io.lunacore.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into chunks at blank-line paragraph boundaries.
 *
 * <p>Paragraphs accumulate into the current chunk until the next one would push the summed paragraph
 * length past the bound; that paragraph then starts a new chunk. A paragraph longer than the bound on
 * its own becomes a single oversized chunk. Paragraphs are never split. Paragraphs inside a chunk are
 * joined with a blank line, which is not counted against the bound.</p>
 */
public class DocumentChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f]*\\n\\s*");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final int maxChars;

    public DocumentChunker(int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("Chunk size bound must be positive, got " + maxChars);
        }
        this.maxChars = maxChars;
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentLength = 0;

        for (String paragraph : paragraphs(text)) {
            if (!current.isEmpty() && currentLength + paragraph.length() > maxChars) {
                chunks.add(String.join(PARAGRAPH_SEPARATOR, current));
                current.clear();
                currentLength = 0;
            }
            current.add(paragraph);
            currentLength += paragraph.length();
        }
        if (!current.isEmpty()) {
            chunks.add(String.join(PARAGRAPH_SEPARATOR, current));
        }
        return chunks;
    }

    static List<String> paragraphs(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<String> paragraphs = new ArrayList<>();
        for (String part : PARAGRAPH_BREAK.split(normalized)) {
            String paragraph = part.strip();
            if (!paragraph.isEmpty()) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }

    public int maxChars() {
        return maxChars;
    }
}
