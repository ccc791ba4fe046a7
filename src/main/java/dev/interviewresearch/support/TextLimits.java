package dev.interviewresearch.support;

/**
 * Character budgets for text sent to the completion service.
 */
public final class TextLimits {

    private TextLimits() {
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }

    /**
     * Characters still available after {@code used} of {@code total}.
     */
    public static int remaining(int total, int used) {
        return Math.max(0, total - used);
    }
}
