package dev.pekelund.pricing.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;

class PageDetailCacheTest {

    private final PageDetailSource source = mock(PageDetailSource.class);
    private final PageDetailCache cache = new PageDetailCache(source);

    @Test
    void fetchesEachFileOnce() {
        when(source.fetchPages("file-1")).thenReturn(List.of(new PageDetail("file-1", 1, 220, "easy")));

        assertThat(cache.isLoaded("file-1")).isFalse();
        assertThat(cache.pagesFor("file-1")).extracting(PageDetail::wordCount).containsExactly(220);
        assertThat(cache.pagesFor("file-1")).hasSize(1);

        assertThat(cache.isLoaded("file-1")).isTrue();
        verify(source, times(1)).fetchPages("file-1");
    }

    @Test
    void failedFetchesAreRetried() {
        when(source.fetchPages("file-2"))
            .thenThrow(new IllegalStateException("OCR service unavailable"))
            .thenReturn(List.of());

        assertThatThrownBy(() -> cache.pagesFor("file-2")).isInstanceOf(IllegalStateException.class);
        assertThat(cache.pagesFor("file-2")).isEmpty();
        verify(source, times(2)).fetchPages("file-2");
    }

    @Test
    void filesWithoutIdHaveNoPages() {
        assertThat(cache.pagesFor(null)).isEmpty();
        verifyNoInteractions(source);
    }
}
