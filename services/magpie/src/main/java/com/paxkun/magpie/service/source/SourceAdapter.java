package com.paxkun.magpie.service.source;

import com.paxkun.magpie.service.discovery.ExtractionStrategy;
import com.paxkun.magpie.service.discovery.RenderingSession;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.Chapter;

import java.time.Duration;
import java.util.List;

/**
 * Site-specific knowledge layered on top of the generic discovery protocol:
 * where a book lives, how its landing page and chapter list look, and how to
 * tell a finished book from an ongoing one.
 * <p>
 * Author: Pax
 */
public interface SourceAdapter {

    /**
     * Short tag naming the site; becomes the top-level directory of active books.
     */
    String siteTag();

    /**
     * Command line option that selects this source, without leading dashes.
     */
    String cliFlag();

    String bookUrl(String bookId);

    /**
     * Reads title and lifecycle from the rendered landing page.
     */
    Book readBook(String bookId, String pageMarkup);

    /**
     * Selector of the element whose inner markup holds the chapter list.
     */
    String chapterListRegion();

    List<ChapterEntry> parseChapterEntries(String chapterListMarkup);

    ChapterOrder chapterOrder();

    /**
     * Selectors that must all be present before a chapter view counts as loaded.
     */
    List<String> chapterViewReadySelectors();

    /**
     * Selector of the control that leads from a chapter view back to the chapter list.
     */
    String returnToListSelector();

    List<ExtractionStrategy> extractionStrategies();

    /**
     * Hook run once before the first chapter is opened.
     */
    default void prepareNavigation(RenderingSession session, Chapter firstPending, Duration timeout) {
    }
}
