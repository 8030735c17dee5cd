package com.smerag.ingest;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }
}
