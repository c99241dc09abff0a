package com.smurthy.ai.insights.service.address;

/**
 * A single web search hit.
 */
public record SearchResult(String title, String snippet, String url) {

    /**
     * Title, snippet and URL joined for pattern matching.
     */
    public String combinedText() {
        return String.join(" ", nullToEmpty(title), nullToEmpty(snippet), nullToEmpty(url));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
