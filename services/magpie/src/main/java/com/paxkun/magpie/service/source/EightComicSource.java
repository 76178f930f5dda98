package com.paxkun.magpie.service.source;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.service.discovery.ExtractionStrategy;
import com.paxkun.magpie.service.discovery.ImageUrlExtractor;
import com.paxkun.magpie.service.discovery.RenderingSession;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.BookState;
import com.paxkun.magpie.service.library.Chapter;
import com.paxkun.magpie.service.library.ChapterHandle;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 8comic.com: chapters are anchors with ids inside {@code div#chapters}, opened by
 * click handlers in place, in reading order.
 */
@Slf4j
@Component
public class EightComicSource implements SourceAdapter {

    static final String SITE_TAG = "8comic";
    private static final String UNKNOWN_TITLE = "Unknown Comic";
    private static final String STATUS_SELECTOR = "div.item-info, a.item_detail_color_gray, span.item-status";

    @Override
    public String siteTag() {
        return SITE_TAG;
    }

    @Override
    public String cliFlag() {
        return "from-8comic";
    }

    @Override
    public String bookUrl(String bookId) {
        return "https://www.8comic.com/html/" + bookId + ".html";
    }

    @Override
    public Book readBook(String bookId, String pageMarkup) {
        Document document = Jsoup.parse(pageMarkup);
        Element nameMeta = document.selectFirst("meta[name=name]");
        String title = nameMeta != null && !nameMeta.attr("content").isBlank()
                ? nameMeta.attr("content").strip()
                : UNKNOWN_TITLE;

        boolean completed = document.select(STATUS_SELECTOR).stream()
                .map(Element::ownText)
                .anyMatch(text -> text.contains("完結") || text.contains("完结"));
        return new Book(bookId, title, SITE_TAG, completed ? BookState.COMPLETED : BookState.ACTIVE);
    }

    @Override
    public String chapterListRegion() {
        return "div#chapters";
    }

    @Override
    public List<ChapterEntry> parseChapterEntries(String chapterListMarkup) {
        Document fragment = Jsoup.parseBodyFragment(chapterListMarkup);
        List<ChapterEntry> entries = new ArrayList<>();
        for (Element anchor : fragment.select("a[id]")) {
            String id = anchor.id().strip();
            if (!id.isEmpty()) {
                entries.add(new ChapterEntry(ChapterHandle.elementId(id), anchor.text().strip()));
            }
        }
        return entries;
    }

    @Override
    public ChapterOrder chapterOrder() {
        return ChapterOrder.READING_ORDER;
    }

    @Override
    public List<String> chapterViewReadySelectors() {
        return List.of("div.comics-end", "div#comics-pics img");
    }

    @Override
    public String returnToListSelector() {
        return "a.view-back";
    }

    @Override
    public List<ExtractionStrategy> extractionStrategies() {
        return ImageUrlExtractor.DEFAULT_CHAIN;
    }

    /**
     * The reader overlay only binds its handlers after one chapter has been opened,
     * so open and close the first pending chapter once.
     */
    @Override
    public void prepareNavigation(RenderingSession session, Chapter firstPending, Duration timeout) {
        try {
            session.click(firstPending.handle().toSelector());
            session.waitForSelector("div.comics-end", timeout);
            session.click(returnToListSelector());
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Warm-up navigation for chapter {} failed: {}", firstPending.index(), e.getMessage());
        }
    }
}
