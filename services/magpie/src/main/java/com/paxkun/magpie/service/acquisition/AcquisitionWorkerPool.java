package com.paxkun.magpie.service.acquisition;

import com.paxkun.magpie.config.AcquisitionSettings;
import com.paxkun.magpie.exception.FetchException;
import com.paxkun.magpie.service.LoggerService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches and normalizes every page of a chapter concurrently. One pool lives for
 * one run; chapters go through it one after another.
 * <p>
 * A chapter is all-or-nothing: if any page exhausts its attempts the whole call fails
 * and no partial page list is returned.
 * <p>
 * Author: Pax
 */
public class AcquisitionWorkerPool implements AutoCloseable {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(5);

    private final ImageFetcher fetcher;
    private final ImageNormalizer normalizer;
    private final LoggerService logger;
    private final AcquisitionSettings settings;
    private final AutoCloseableExecutor workers;

    public AcquisitionWorkerPool(ImageFetcher fetcher,
                                 ImageNormalizer normalizer,
                                 LoggerService logger,
                                 AcquisitionSettings settings) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.logger = logger;
        this.settings = settings;
        this.workers = new AutoCloseableExecutor(
                Executors.newFixedThreadPool(settings.effectiveWorkers(), workerThreadFactory()),
                logger,
                SHUTDOWN_TIMEOUT);
        logger.debug("ACQUIRE", "Worker pool started with " + settings.effectiveWorkers() + " workers");
    }

    /**
     * @param urls         page URLs in reading order
     * @param referer      page to present as Referer, may be null
     * @param chapterLabel chapter description used in log lines
     * @return normalized pages in the same order as {@code urls}
     * @throws FetchException if any page could not be acquired
     */
    public List<EncodedImage> acquire(List<String> urls, String referer, String chapterLabel) {
        List<Future<EncodedImage>> futures = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            int page = i + 1;
            futures.add(workers.executor().submit(() -> acquireOne(url, referer, chapterLabel, page)));
        }

        List<EncodedImage> images = new ArrayList<>(urls.size());
        try {
            for (Future<EncodedImage> future : futures) {
                images.add(future.get());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            throw new FetchException("Essential image missing for " + chapterLabel + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new FetchException("Acquisition interrupted for " + chapterLabel, e);
        }

        logger.info("ACQUIRE", "Acquired " + images.size() + " pages for " + chapterLabel);
        return List.copyOf(images);
    }

    private EncodedImage acquireOne(String url, String referer, String chapterLabel, int page) throws InterruptedException {
        int maxAttempts = settings.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                byte[] raw = fetcher.fetch(url, referer);
                return normalizer.normalize(raw);
            } catch (RuntimeException e) {
                logger.warn("ACQUIRE", "Attempt " + attempt + "/" + maxAttempts + " failed for " + chapterLabel
                        + " page " + page + " | url=" + url + " | " + e.getMessage());
                if (attempt >= maxAttempts) {
                    logger.error("ACQUIRE", "Permanent failure for " + chapterLabel + " page " + page + " | url=" + url, e);
                    throw new FetchException("Essential image missing: " + url, e);
                }
            }
            Thread.sleep(settings.backoffAfter(attempt).toMillis());
        }
    }

    private void cancelAll(List<Future<EncodedImage>> futures) {
        for (Future<EncodedImage> future : futures) {
            future.cancel(true);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "magpie-acquire-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        workers.close();
    }
}
