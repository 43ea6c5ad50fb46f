package com.motionindex.processing.classification;

import com.motionindex.util.Strings;

import java.util.List;

/**
 * Prompt text shared by all LLM-backed providers.
 */
public final class ClassificationPrompts {

    static final List<String> DOCUMENT_TYPES = List.of(
            "motion_to_suppress", "motion_to_dismiss", "motion_to_compel", "motion_in_limine",
            "motion_summary_judgment", "motion_to_strike", "motion_for_reconsideration",
            "motion_to_amend", "motion_for_continuance", "order", "ruling", "judgment", "sentence",
            "injunction", "brief", "complaint", "answer", "plea", "reply", "docket_entry", "notice",
            "stipulation", "correspondence", "transcript", "evidence", "other");

    static final List<String> LEGAL_CATEGORIES = List.of(
            "Criminal Law", "Civil Law", "Contract Law", "Family Law", "Property Law",
            "Employment Law", "Intellectual Property", "Tax Law", "Constitutional Law",
            "Administrative Law", "Other");

    private ClassificationPrompts() {
        // Utility class
    }

    /**
     * Builds the classification prompt, cutting the document text to {@code maxTextLength}.
     */
    public static String build(String text, ClassificationMetadata metadata, int maxTextLength) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert legal document analyzer. Classify the following legal document.\n\n");
        prompt.append("Respond with a single JSON object and nothing else, using these keys:\n");
        prompt.append("  \"document_type\": one of ").append(String.join(", ", DOCUMENT_TYPES)).append("\n");
        prompt.append("  \"legal_category\": one of ").append(String.join(", ", LEGAL_CATEGORIES)).append("\n");
        prompt.append("  \"sub_category\": short free text\n");
        prompt.append("  \"subject\": one-line subject of the document\n");
        prompt.append("  \"summary\": two or three sentence summary\n");
        prompt.append("  \"confidence\": number between 0 and 1\n");
        prompt.append("  \"keywords\": array of strings\n");
        prompt.append("  \"legal_tags\": array of strings\n\n");

        if (metadata != null) {
            if (!Strings.isBlank(metadata.getFileName())) {
                prompt.append("Filename: ").append(metadata.getFileName()).append("\n");
            }
            metadata.getAttributes().forEach((key, value) ->
                    prompt.append(key).append(": ").append(value).append("\n"));
        }

        prompt.append("\nDocument text:\n");
        prompt.append(Strings.truncate(text, maxTextLength));
        return prompt.toString();
    }
}
