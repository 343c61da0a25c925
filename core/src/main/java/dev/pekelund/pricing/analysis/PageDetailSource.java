package dev.pekelund.pricing.analysis;

import java.util.List;

/**
 * Remote source of per-page OCR detail.
 */
@FunctionalInterface
public interface PageDetailSource {

    List<PageDetail> fetchPages(String fileId);
}
