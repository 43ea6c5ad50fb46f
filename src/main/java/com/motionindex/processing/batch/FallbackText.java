package com.motionindex.processing.batch;

import java.util.Locale;

/**
 * Builds classifiable text for a document whose content could not be read, from the
 * little that is known about it: its file path or ID.
 */
public final class FallbackText {

    private FallbackText() {
        // Utility class
    }

    /**
     * @return the synthesized text, or an empty string when neither a path nor an ID is known
     */
    public static String generate(String documentPath, String documentId) {
        String source = documentPath != null && !documentPath.isBlank() ? documentPath : documentId;
        if (source == null || source.isBlank()) {
            return "";
        }

        String fileName = baseName(source);
        String cleanName = stripExtension(fileName).replace('_', ' ').replace('-', ' ').trim();

        StringBuilder text = new StringBuilder();
        text.append("Document: ").append(cleanName).append('\n');
        text.append("File Path: ").append(source).append('\n');
        text.append("Filename: ").append(fileName);
        text.append('\n').append("Document Type: ").append(inferDocumentType(fileName));
        return text.toString();
    }

    static String inferDocumentType(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.contains("motion")) {
            return "Legal Motion";
        }
        if (lower.contains("complaint")) {
            return "Legal Complaint";
        }
        if (lower.contains("order")) {
            return "Court Order";
        }
        if (lower.contains("brief")) {
            return "Legal Brief";
        }
        if (lower.contains("petition")) {
            return "Legal Petition";
        }
        if (lower.contains("notice")) {
            return "Legal Notice";
        }
        if (lower.contains("filing")) {
            return "Court Filing";
        }
        return "Legal Document";
    }

    private static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
