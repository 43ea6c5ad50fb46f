package com.motionindex.processing.extraction;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Text extraction for PDF (PDFBox text layer, no OCR) and plain text formats.
 */
@Service
public class DocumentTextExtractionService implements TextExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTextExtractionService.class);
    private static final String PDF_CONTENT_TYPE = "application/pdf";
    // No language detection; the corpus is English-language court filings.
    private static final String DEFAULT_LANGUAGE = "en";

    @Override
    public ExtractionResult extract(InputStream content, String fileName, String contentType) {
        if (content == null) {
            return ExtractionResult.failure("no content to extract");
        }
        String format = detectFormat(fileName, contentType);
        try {
            switch (format) {
                case "pdf":
                    return extractPdf(content);
                case "text":
                    return extractPlainText(content);
                default:
                    return ExtractionResult.failure("unsupported document format: "
                            + (contentType != null ? contentType : fileName));
            }
        } catch (IOException e) {
            logger.warn("Text extraction failed for {}: {}", fileName, e.getMessage());
            return ExtractionResult.failure("extraction failed: " + e.getMessage());
        }
    }

    static String detectFormat(String fileName, String contentType) {
        String type = contentType != null ? contentType.toLowerCase(Locale.ROOT) : "";
        String name = fileName != null ? fileName.toLowerCase(Locale.ROOT) : "";
        if (type.contains(PDF_CONTENT_TYPE) || name.endsWith(".pdf")) {
            return "pdf";
        }
        if (type.startsWith("text/") || name.endsWith(".txt") || name.endsWith(".md")) {
            return "text";
        }
        return "unknown";
    }

    private ExtractionResult extractPdf(InputStream content) throws IOException {
        byte[] pdfBytes = content.readAllBytes();
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            int pages = document.getNumberOfPages();
            logger.debug("PDFBox extracted {} pages, {} chars", pages, text.length());
            if (text.isBlank()) {
                return ExtractionResult.failure("PDF has no text layer");
            }
            return ExtractionResult.success(text.trim(), pages, DEFAULT_LANGUAGE);
        }
    }

    private ExtractionResult extractPlainText(InputStream content) throws IOException {
        String text = new String(content.readAllBytes(), StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return ExtractionResult.failure("document is empty");
        }
        return ExtractionResult.success(text.trim(), 1, DEFAULT_LANGUAGE);
    }
}
