package com.motionindex.processing.classification;

/**
 * A categorized classification failure. The message is the human-readable form
 * surfaced to callers: {@code Classification failed [CATEGORY]: detail}.
 */
public class ClassificationException extends Exception {

    private final ErrorCategory category;
    private final String provider;
    private final String detail;

    public ClassificationException(ErrorCategory category, String provider, String detail) {
        this(category, provider, detail, null);
    }

    public ClassificationException(ErrorCategory category, String provider, String detail, Throwable cause) {
        super(format(category, provider, detail), cause);
        this.category = category;
        this.provider = provider;
        this.detail = detail;
    }

    private static String format(ErrorCategory category, String provider, String detail) {
        StringBuilder sb = new StringBuilder("Classification failed [").append(category).append("]");
        if (provider != null) {
            sb.append(" (").append(provider).append(")");
        }
        return sb.append(": ").append(detail).toString();
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getProvider() {
        return provider;
    }

    public String getDetail() {
        return detail;
    }
}
