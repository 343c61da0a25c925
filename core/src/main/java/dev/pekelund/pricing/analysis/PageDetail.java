package dev.pekelund.pricing.analysis;

/**
 * Per-page OCR detail for an uploaded file.
 */
public record PageDetail(
    String fileId,
    int pageNumber,
    int wordCount,
    String complexity
) {

    public PageDetail {
        wordCount = Math.max(0, wordCount);
    }
}
