package com.smurthy.ai.insights.repository;

import java.util.Locale;

/**
 * Builds case-insensitive substring patterns for SQL {@code LIKE ... ESCAPE '\'}.
 */
final class LikePatterns {

    private LikePatterns() {
    }

    static String contains(String text) {
        String escaped = text.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
