package pl.faktulove.ocr.extraction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a match by the label words that precede it. When several labels appear,
 * the one closest to the match wins.
 */
public final class ContextClassifier<K> {

    private final Map<K, List<String>> keywords;
    private final int window;

    public ContextClassifier(Map<K, List<String>> keywords, int window) {
        this.keywords = keywords;
        this.window = window;
    }

    public Optional<K> classify(String text, int matchStart) {
        String context = text.substring(Math.max(0, matchStart - window), matchStart).toLowerCase(Locale.ROOT);
        K best = null;
        int bestIndex = -1;
        for (Map.Entry<K, List<String>> entry : keywords.entrySet()) {
            for (String keyword : entry.getValue()) {
                int index = context.lastIndexOf(keyword);
                if (index >= 0 && index + keyword.length() > bestIndex) {
                    bestIndex = index + keyword.length();
                    best = entry.getKey();
                }
            }
        }
        return Optional.ofNullable(best);
    }
}
