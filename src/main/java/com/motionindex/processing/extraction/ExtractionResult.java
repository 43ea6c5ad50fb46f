package com.motionindex.processing.extraction;

/**
 * Text pulled out of one document.
 */
public class ExtractionResult {

    private final String text;
    private final int pageCount;
    private final String language;
    private final boolean success;
    private final String error;

    private ExtractionResult(String text, int pageCount, String language, boolean success, String error) {
        this.text = text;
        this.pageCount = pageCount;
        this.language = language;
        this.success = success;
        this.error = error;
    }

    public static ExtractionResult success(String text, int pageCount, String language) {
        return new ExtractionResult(text, pageCount, language, true, null);
    }

    public static ExtractionResult failure(String error) {
        return new ExtractionResult("", 0, null, false, error);
    }

    public String getText() {
        return text;
    }

    public int getPageCount() {
        return pageCount;
    }

    public String getLanguage() {
        return language;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public boolean hasText() {
        return success && text != null && !text.isBlank();
    }
}
