package com.example.autoslides_backend.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Filesystem-safe names derived from deck topics: {@code "Energía solar: 2025"} becomes {@code "energia-solar-2025"}.
 */
public final class Slugifier {
    public static final String FALLBACK = "deck";
    public static final int MAX_LENGTH = 60;

    private Slugifier() {}

    public static String slugify(String text) {
        if (text == null) {
            return FALLBACK;
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char ch = decomposed.charAt(i);
            if (Character.getType(ch) == Character.NON_SPACING_MARK) {
                continue;
            }
            char lower = Character.toLowerCase(ch);
            if (Character.isLetterOrDigit(lower)) {
                sb.append(lower);
            } else if (Character.isWhitespace(lower) || lower == '-' || lower == '_' || lower == '.') {
                sb.append('-');
            }
        }
        String slug = sb.toString().toLowerCase(Locale.ROOT).replaceAll("-{2,}", "-");
        slug = trimDashes(slug);
        if (slug.length() > MAX_LENGTH) {
            slug = trimDashes(slug.substring(0, MAX_LENGTH));
        }
        return slug.isEmpty() ? FALLBACK : slug;
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') start++;
        while (end > start && value.charAt(end - 1) == '-') end--;
        return value.substring(start, end);
    }
}
