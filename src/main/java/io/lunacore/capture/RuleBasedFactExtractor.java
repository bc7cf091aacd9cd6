package io.lunacore.capture;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fast, pattern-based extraction of stable, high-signal facts. No model calls.
 *
 * <p>Recognizes explicit "remember" directives, the user's name, where they live, the wake phrase,
 * and short utterances carrying concrete audio device strings.</p>
 */
public class RuleBasedFactExtractor implements FactExtractor {

    private static final Pattern REMEMBER = Pattern.compile(
            "\\bremember\\b[:\\s-]*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME = Pattern.compile(
            "\\bmy name is\\s+([A-Za-z0-9][A-Za-z0-9 _-]{1,48})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCATION = Pattern.compile(
            "\\bi (?:live|am located)\\s+in\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WAKE_PHRASE = Pattern.compile(
            "\\bwake(?:\\s+word|\\s+phrase)?\\s+is\\s+([A-Za-z0-9][A-Za-z0-9 _-]{1,28})\\b", Pattern.CASE_INSENSITIVE);

    private static final int MAX_AUDIO_HINT_LENGTH = 160;

    @Override
    public List<CandidateFact> extract(String utterance) {
        String text = utterance == null ? "" : utterance.strip();
        if (text.isEmpty()) {
            return List.of();
        }

        List<CandidateFact> facts = new ArrayList<>();

        Matcher m = REMEMBER.matcher(text);
        if (m.find()) {
            String value = stripQuotes(m.group(1).strip());
            if (!value.isEmpty()) {
                facts.add(new CandidateFact("remember", value, 0.95));
            }
        }

        m = NAME.matcher(text);
        if (m.find()) {
            facts.add(new CandidateFact("user_name", m.group(1).strip(), 0.95));
        }

        m = LOCATION.matcher(text);
        if (m.find()) {
            String value = m.group(1).strip();
            if (value.endsWith(".")) {
                value = value.substring(0, value.length() - 1);
            }
            if (value.length() >= 2 && value.length() <= 80) {
                facts.add(new CandidateFact("user_location", value, 0.8));
            }
        }

        m = WAKE_PHRASE.matcher(text);
        if (m.find()) {
            facts.add(new CandidateFact("wake_phrase", m.group(1).strip(), 0.9));
        }

        if ((text.contains("plughw:") || text.contains("hw:") || text.contains("AUDIO_OUT"))
                && text.length() <= MAX_AUDIO_HINT_LENGTH) {
            facts.add(new CandidateFact("audio_hint", text, 0.6));
        }

        return dedupe(facts);
    }

    private List<CandidateFact> dedupe(List<CandidateFact> facts) {
        Set<String> seen = new LinkedHashSet<>();
        List<CandidateFact> unique = new ArrayList<>();
        for (CandidateFact fact : facts) {
            String key = fact.key() == null ? "" : fact.key().strip();
            String value = fact.value() == null ? "" : fact.value().strip();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }
            if (seen.add(key + '\u0000' + value)) {
                unique.add(new CandidateFact(key, value, fact.confidence()));
            }
        }
        return unique;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '"' || s.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '"' || s.charAt(end - 1) == '\'')) {
            end--;
        }
        return s.substring(start, end);
    }
}
