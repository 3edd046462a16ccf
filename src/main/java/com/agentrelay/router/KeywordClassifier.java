package com.agentrelay.router;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic classifier: the first label with a keyword present as a whole
 * word wins with confidence 1.0.
 */
public class KeywordClassifier implements Classifier {

    private final Map<String, List<Pattern>> patterns = new LinkedHashMap<>();

    public KeywordClassifier(Map<String, List<String>> keywords) {
        keywords.forEach((label, words) -> {
            var compiled = new ArrayList<Pattern>();
            for (var w : words) {
                compiled.add(Pattern.compile("\\b" + Pattern.quote(w.toLowerCase(Locale.ROOT)) + "\\b"));
            }
            patterns.put(label, compiled);
        });
    }

    @Override
    public Classification classify(String text) {
        if (text == null || text.isBlank()) return Classification.unknown();
        var lower = text.toLowerCase(Locale.ROOT);
        for (var entry : patterns.entrySet()) {
            for (var p : entry.getValue()) {
                if (p.matcher(lower).find()) {
                    return new Classification(entry.getKey(), 1.0);
                }
            }
        }
        return Classification.unknown();
    }
}
