package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.config.NavigationSettings;
import com.paxkun.magpie.exception.ArtifactIOException;
import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.exception.NavigationTimeoutException;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.Chapter;
import com.paxkun.magpie.service.source.SourceAdapter;
import com.paxkun.magpie.service.storage.ArtifactStore;
import com.paxkun.magpie.service.storage.BookLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the pending chapters of a book through one rendering session, strictly one
 * at a time: open the chapter, extract its image URLs, persist the URL list, go back
 * to the chapter list.
 * <p>
 * A chapter that cannot be opened or yields no images is skipped and reported. The walk
 * ends early only when the rendering engine is lost or the chapter list cannot be
 * reached again.
 * <p>
 * Author: Pax
 */
@Component
@RequiredArgsConstructor
public class ChapterNavigationController {

    private final ImageUrlExtractor extractor;
    private final ArtifactStore artifactStore;
    private final LoggerService logger;
    private final NavigationSettings settings;

    /**
     * @throws FatalRunException if the rendering session dies or the chapter list is unreachable
     */
    public List<ChapterResult> discover(RenderingSession session,
                                        SourceAdapter source,
                                        Book book,
                                        BookLayout layout,
                                        List<Chapter> chapters) {
        List<ChapterResult> results = new ArrayList<>(chapters.size());
        for (Chapter chapter : chapters) {
            logger.info("NAVIGATE", "Processing chapter " + chapter.index() + ": " + chapter.name());
            ChapterResult result;
            try {
                result = discoverChapter(session, source, layout, chapter);
            } catch (FatalRunException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("NAVIGATE", "Failed chapter " + chapter.index() + " (" + chapter.name() + ")", e);
                result = ChapterResult.skipped(chapter, SkipReason.RENDERING_ERROR);
            }

            if (!result.isPersisted()) {
                logger.warn("NAVIGATE", "Skipped chapter " + chapter.index() + " (" + chapter.name() + "): " + result.skipReason());
            }
            results.add(result);
            returnToChapterList(session, source, book, chapter);
        }
        return results;
    }

    private ChapterResult discoverChapter(RenderingSession session, SourceAdapter source, BookLayout layout, Chapter chapter) {
        if (!navigateToChapter(session, source, chapter)) {
            return ChapterResult.skipped(chapter, SkipReason.NAVIGATION_TIMEOUT);
        }

        String baseUrl = session.currentUrl();
        List<String> imageUrls = extractor.extract(session.pageSource(), baseUrl, source.extractionStrategies());
        if (imageUrls.isEmpty()) {
            logger.error("NAVIGATE", "No images found for chapter " + chapter.index() + " at " + baseUrl);
            return ChapterResult.skipped(chapter, SkipReason.EXTRACTION_EMPTY);
        }

        Path urlList = layout.urlListPath(chapter);
        try {
            artifactStore.writeUrlList(urlList, imageUrls);
        } catch (ArtifactIOException e) {
            logger.error("NAVIGATE", "Could not persist URL list for chapter " + chapter.index(), e);
            return ChapterResult.skipped(chapter, SkipReason.ARTIFACT_IO);
        }
        return ChapterResult.persisted(chapter, urlList, imageUrls.size());
    }

    /**
     * @return false once every attempt timed out
     */
    private boolean navigateToChapter(RenderingSession session, SourceAdapter source, Chapter chapter) {
        int maxAttempts = settings.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                session.click(chapter.handle().toSelector());
                for (String selector : source.chapterViewReadySelectors()) {
                    session.waitForSelector(selector, settings.timeout());
                }
                return true;
            } catch (NavigationTimeoutException e) {
                if (attempt == maxAttempts) {
                    logger.error("NAVIGATE", "Navigation to chapter " + chapter.index() + " failed after "
                            + maxAttempts + " attempts", e);
                    return false;
                }
                logger.warn("NAVIGATE", "Retrying chapter " + chapter.index() + " (" + attempt + "/" + maxAttempts
                        + "): " + e.getMessage());
                session.reload();
            }
        }
        return false;
    }

    /**
     * Clicks the back control, or reopens the book page when that fails.
     *
     * @throws FatalRunException if the chapter list cannot be reached either way
     */
    private void returnToChapterList(RenderingSession session, SourceAdapter source, Book book, Chapter chapter) {
        try {
            session.click(source.returnToListSelector());
            session.waitForSelector(source.chapterListRegion(), settings.timeout());
            return;
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("NAVIGATE", "Back control failed after chapter " + chapter.index() + " (" + chapter.name()
                    + "): " + e.getMessage());
        }

        String bookUrl = source.bookUrl(book.bookId());
        logger.info("NAVIGATE", "Reopening chapter list at " + bookUrl);
        try {
            session.navigate(bookUrl);
            session.waitForSelector(source.chapterListRegion(), settings.timeout());
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FatalRunException("Chapter list unreachable after chapter " + chapter.index()
                    + ", even from " + bookUrl, e);
        }
    }
}
