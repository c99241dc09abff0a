package com.smurthy.ai.insights.chat;

/**
 * Normalization helpers shared by the intent matchers.
 */
public final class TextParams {

    private TextParams() {
    }

    /**
     * Trims whitespace and any trailing {@code ? . , !} characters.
     */
    public static String cleanName(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.strip();
        int end = cleaned.length();
        while (end > 0 && "?.,!".indexOf(cleaned.charAt(end - 1)) >= 0) {
            end--;
        }
        return cleaned.substring(0, end).strip();
    }

    /**
     * Parses a requested count, using {@code defaultValue} when absent and clamping the
     * result into {@code [1, max]}. Oversized requests are capped, never rejected.
     */
    public static int clampedCount(String raw, int defaultValue, int max) {
        int requested = defaultValue;
        if (raw != null && !raw.isBlank()) {
            try {
                requested = Integer.parseInt(raw.strip());
            } catch (NumberFormatException e) {
                // digits too long for an int
                requested = max;
            }
        }
        return Math.max(1, Math.min(requested, max));
    }
}
