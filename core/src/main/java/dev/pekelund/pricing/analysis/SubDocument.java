package dev.pekelund.pricing.analysis;

/**
 * One logical document detected by AI analysis inside an uploaded file.
 */
public record SubDocument(
    String type,
    String holderName,
    String pageRange,
    String language
) {
}
