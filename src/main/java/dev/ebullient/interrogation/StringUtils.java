package dev.ebullient.interrogation;

import java.util.Locale;

public class StringUtils {

    private StringUtils() {
    }

    /**
     * Convert a name into a URL-friendly slug.
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "untitled";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s_-]", "") // Remove special characters
                .trim()
                .replaceAll("\\s+", "-") // Replace spaces with hyphens
                .replaceAll("-+", "-") // Replace multiple hyphens with single
                .replaceAll("^-|-$", ""); // Remove leading/trailing hyphens
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }

    /** Shorten text for log output. */
    public static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max) + "...";
    }
}
