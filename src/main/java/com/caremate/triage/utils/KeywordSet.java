package com.caremate.triage.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ordered set of literal keywords or phrases matched on whole words, case-insensitively.
 * Common inflections are accepted ("light" matches "lights", "hurt" matches "hurting", "pain" matches
 * "painful", "help" matches "helpless"); other longer words are not ("pain" never matches "painting").
 */
public final class KeywordSet {

    private static final String INFLECTION = "(?:s|es|ed|ing|ful|less)?";

    private final Map<String, Pattern> patterns;

    private KeywordSet(List<String> keywords) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String keyword : keywords) {
            compiled.put(keyword, Pattern.compile(
                    "\\b" + Pattern.quote(keyword) + INFLECTION + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    public static KeywordSet of(String... keywords) {
        return new KeywordSet(List.of(keywords));
    }

    /** Keywords found in {@code text}, in declaration order. */
    public List<String> matches(String text) {
        if (text == null || text.isEmpty()) return Collections.emptyList();
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
            if (e.getValue().matcher(text).find()) {
                found.add(e.getKey());
            }
        }
        return found;
    }

    public boolean anyMatch(String text) {
        if (text == null || text.isEmpty()) return false;
        for (Pattern p : patterns.values()) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    public List<String> keywords() {
        return new ArrayList<>(patterns.keySet());
    }
}
