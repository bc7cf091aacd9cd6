package io.lunacore.memory;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders pinned memories as the trusted-facts block injected into the language model prompt.
 */
public final class PinnedContextFormatter {

    public static final String HEADER = "Pinned user facts (trusted):";

    private PinnedContextFormatter() {
    }

    /**
     * @return the formatted block, or an empty string when there are no facts
     */
    public static String format(List<MemoryEntry> pinned) {
        if (pinned == null || pinned.isEmpty()) {
            return "";
        }
        StringJoiner lines = new StringJoiner("\n");
        lines.add(HEADER);
        for (MemoryEntry entry : pinned) {
            lines.add("- " + entry.asLine());
        }
        return lines.toString();
    }
}
