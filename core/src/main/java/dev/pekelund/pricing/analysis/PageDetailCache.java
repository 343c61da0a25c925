package dev.pekelund.pricing.analysis;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session scoped cache of page detail. A file's pages are fetched on first request and never
 * refetched while the cache lives. Failed fetches are not cached so the next request retries.
 */
public class PageDetailCache {

    private static final Logger log = LoggerFactory.getLogger(PageDetailCache.class);

    private final PageDetailSource source;
    private final ConcurrentMap<String, List<PageDetail>> pagesByFile = new ConcurrentHashMap<>();

    public PageDetailCache(PageDetailSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public List<PageDetail> pagesFor(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            return List.of();
        }
        return pagesByFile.computeIfAbsent(fileId, key -> {
            log.debug("Loading page detail for file {}", key);
            List<PageDetail> pages = source.fetchPages(key);
            return pages != null ? List.copyOf(pages) : List.of();
        });
    }

    public boolean isLoaded(String fileId) {
        return fileId != null && pagesByFile.containsKey(fileId);
    }
}
