package com.phillippitts.essaydefense.util;

/** Utility for privacy-safe logging of essay and transcript previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Single-line preview: line breaks collapsed to spaces, then truncated with an ellipsis marker.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    /**
     * Masks a credential for logs, keeping only its length.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<empty>";
        }
        return "<" + secret.length() + " chars>";
    }
}
