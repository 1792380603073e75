package com.caremate.triage.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

public final class TextNormalizer {

    private TextNormalizer() {
    }

    /** Lower-cases, folds typographic apostrophes and collapses whitespace. Null becomes empty. */
    public static String normalize(String text) {
        if (StringUtils.isBlank(text)) return "";
        String folded = text.replace('’', '\'').replace('‘', '\'');
        return StringUtils.normalizeSpace(folded).toLowerCase(Locale.ROOT);
    }
}
