package com.paxkun.magpie.service.acquisition;

import com.paxkun.magpie.config.AcquisitionSettings;
import com.paxkun.magpie.exception.DecodeException;
import com.paxkun.magpie.exception.FetchException;
import com.paxkun.magpie.service.LoggerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcquisitionWorkerPoolTest {

    @Mock
    private ImageFetcher fetcher;

    @Mock
    private ImageNormalizer normalizer;

    @Mock
    private LoggerService logger;

    private AcquisitionWorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new AcquisitionWorkerPool(fetcher, normalizer, logger,
                new AcquisitionSettings(8, 3, Duration.ofMillis(1)));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void keepsInputOrderWhateverTheCompletionOrder() {
        when(fetcher.fetch(anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(ThreadLocalRandom.current().nextInt(0, 40));
            return ((String) invocation.getArgument(0)).getBytes(StandardCharsets.UTF_8);
        });
        when(normalizer.normalize(any())).thenAnswer(invocation -> new EncodedImage(invocation.getArgument(0), 10, 10));

        List<String> urls = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            urls.add("https://img.example.com/page-" + i + ".jpg");
        }

        List<EncodedImage> images = pool.acquire(urls, "https://www.example.com/book", "ch0001 - Start");

        List<String> order = images.stream()
                .map(image -> new String(image.bytes(), StandardCharsets.UTF_8))
                .collect(Collectors.toList());
        assertThat(order).containsExactlyElementsOf(urls);
    }

    @Test
    void failsWholeChapterWhenOnePageNeverArrives() {
        String broken = "https://img.example.com/broken.jpg";
        when(fetcher.fetch(anyString(), any())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.equals(broken)) {
                throw new FetchException("HTTP 404 from " + url);
            }
            return url.getBytes(StandardCharsets.UTF_8);
        });
        when(normalizer.normalize(any())).thenAnswer(invocation -> new EncodedImage(invocation.getArgument(0), 10, 10));

        List<String> urls = List.of(
                "https://img.example.com/1.jpg",
                broken,
                "https://img.example.com/3.jpg");

        assertThatThrownBy(() -> pool.acquire(urls, null, "ch0002 - Middle"))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining(broken);
        verify(fetcher, times(3)).fetch(eq(broken), any());
        verify(logger, atLeastOnce()).error(eq("ACQUIRE"), contains("ch0002 - Middle"), any(FetchException.class));
    }

    @Test
    void retriesTransientFailuresUntilAPageDecodes() {
        String url = "https://img.example.com/flaky.jpg";
        byte[] raw = {1, 2, 3};
        when(fetcher.fetch(url, null))
                .thenThrow(new FetchException("connection reset"))
                .thenReturn(raw)
                .thenReturn(raw);
        when(normalizer.normalize(raw))
                .thenThrow(new DecodeException("Image failed integrity check"))
                .thenReturn(new EncodedImage(new byte[]{9}, 1600, 2400));

        List<EncodedImage> images = pool.acquire(List.of(url), null, "ch0003 - End");

        assertThat(images).hasSize(1);
        assertThat(images.get(0).height()).isEqualTo(2400);
        verify(fetcher, times(3)).fetch(url, null);
        verify(logger, times(2)).warn(eq("ACQUIRE"), contains("failed for ch0003 - End page 1"));
    }

    @Test
    void emptyChapterYieldsNoPages() {
        assertThat(pool.acquire(List.of(), null, "ch0004 - Empty")).isEmpty();
    }
}
