package dev.newsroom.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * URL-safe slugs for story titles.
 */
public final class SlugUtils {

    private static final Pattern DIACRITICALS = Pattern.compile("[\\p{InCombiningDiacriticalMarks}]");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^a-z0-9]+");
    private static final Pattern LEADING_TRAILING_HYPHENS = Pattern.compile("^-+|-+$");
    private static final int MAX_LENGTH = 120;

    private SlugUtils() {
    }

    /**
     * Removes diacritics, lowercases, and collapses everything else into single hyphens.
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "untitled";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = DIACRITICALS.matcher(normalized).replaceAll("");
        String slugged = NON_SLUG_CHARS.matcher(stripped.toLowerCase()).replaceAll("-");
        String trimmed = LEADING_TRAILING_HYPHENS.matcher(slugged).replaceAll("");
        if (trimmed.length() > MAX_LENGTH) {
            trimmed = LEADING_TRAILING_HYPHENS.matcher(trimmed.substring(0, MAX_LENGTH)).replaceAll("");
        }
        return trimmed.isEmpty() ? "untitled" : trimmed;
    }
}
