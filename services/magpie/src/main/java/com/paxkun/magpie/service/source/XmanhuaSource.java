package com.paxkun.magpie.service.source;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.service.discovery.ExtractionStrategy;
import com.paxkun.magpie.service.discovery.ImageUrlExtractor;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.BookState;
import com.paxkun.magpie.service.library.ChapterHandle;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * xmanhua.com: chapter links are listed newest first and carry a page-count
 * {@code <span>} that is not part of the chapter name.
 */
@Component
public class XmanhuaSource implements SourceAdapter {

    static final String SITE_TAG = "xmanhua";

    private static final List<ExtractionStrategy> STRATEGIES;

    static {
        List<ExtractionStrategy> strategies = new ArrayList<>(ImageUrlExtractor.DEFAULT_CHAIN);
        strategies.add(ExtractionStrategy.encodedAttribute("img[data-original]", "data-original"));
        STRATEGIES = List.copyOf(strategies);
    }

    @Override
    public String siteTag() {
        return SITE_TAG;
    }

    @Override
    public String cliFlag() {
        return "from-xmanhua";
    }

    @Override
    public String bookUrl(String bookId) {
        return "https://www.xmanhua.com/" + bookId + "/";
    }

    @Override
    public Book readBook(String bookId, String pageMarkup) {
        Document document = Jsoup.parse(pageMarkup);
        Element titleElement = document.selectFirst("p.detail-info-title");
        if (titleElement == null || titleElement.text().isBlank()) {
            throw new FatalRunException("Book title not found on landing page of " + bookId);
        }

        boolean completed = document.select("p.detail-info-tip span").stream()
                .map(Element::text)
                .anyMatch(text -> text.contains("完結") || text.contains("完结"));
        return new Book(bookId, titleElement.text().strip(), SITE_TAG, completed ? BookState.COMPLETED : BookState.ACTIVE);
    }

    @Override
    public String chapterListRegion() {
        return "div.detail-list-form-con";
    }

    @Override
    public List<ChapterEntry> parseChapterEntries(String chapterListMarkup) {
        Document fragment = Jsoup.parseBodyFragment(chapterListMarkup);
        List<ChapterEntry> entries = new ArrayList<>();
        for (Element anchor : fragment.select("a.detail-list-form-item")) {
            String href = anchor.attr("href").strip();
            if (href.isEmpty()) {
                continue;
            }
            Element copy = anchor.clone();
            copy.select("span").remove();
            entries.add(new ChapterEntry(ChapterHandle.href(href), copy.text().strip()));
        }
        return entries;
    }

    @Override
    public ChapterOrder chapterOrder() {
        return ChapterOrder.NEWEST_FIRST;
    }

    @Override
    public List<String> chapterViewReadySelectors() {
        return List.of("img[src], img[data-src]");
    }

    @Override
    public String returnToListSelector() {
        return "a.view-back";
    }

    @Override
    public List<ExtractionStrategy> extractionStrategies() {
        return STRATEGIES;
    }
}
