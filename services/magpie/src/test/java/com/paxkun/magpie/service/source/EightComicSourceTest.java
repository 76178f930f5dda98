package com.paxkun.magpie.service.source;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.exception.NavigationTimeoutException;
import com.paxkun.magpie.service.discovery.RenderingSession;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.BookState;
import com.paxkun.magpie.service.library.Chapter;
import com.paxkun.magpie.service.library.ChapterHandle;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.ElementClickInterceptedException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EightComicSourceTest {

    private final EightComicSource source = new EightComicSource();

    @Test
    void readsTitleAndCompletedLabel() {
        String page = "<html><head><meta name=\"name\" content=\" 海賊王 \"></head>"
                + "<body><div class=\"item-info\">狀態：已完結</div></body></html>";

        Book book = source.readBook("103", page);

        assertThat(book).isEqualTo(new Book("103", "海賊王", "8comic", BookState.COMPLETED));
    }

    @Test
    void fallsBackToUnknownTitleForOngoingBook() {
        Book book = source.readBook("7", "<html><body><span class=\"item-status\">連載中</span></body></html>");

        assertThat(book.title()).isEqualTo("Unknown Comic");
        assertThat(book.isCompleted()).isFalse();
    }

    @Test
    void parsesChapterAnchorsById() {
        String list = "<a id=\"c1\" href=\"#\">第1話 </a><a href=\"#\">ad</a><a id=\"c2\" href=\"#\">第2話</a>";

        List<ChapterEntry> entries = source.parseChapterEntries(list);

        assertThat(entries).containsExactly(
                new ChapterEntry(ChapterHandle.elementId("c1"), "第1話"),
                new ChapterEntry(ChapterHandle.elementId("c2"), "第2話"));
        assertThat(source.bookUrl("103")).isEqualTo("https://www.8comic.com/html/103.html");
        assertThat(source.chapterOrder()).isEqualTo(ChapterOrder.READING_ORDER);
    }

    @Test
    void warmUpOpensAndClosesFirstPendingChapter() {
        RenderingSession session = mock(RenderingSession.class);
        Chapter first = new Chapter(5, "第5話", ChapterHandle.elementId("c5"));

        source.prepareNavigation(session, first, Duration.ofSeconds(2));

        verify(session).click("a[id=\"c5\"]");
        verify(session).waitForSelector("div.comics-end", Duration.ofSeconds(2));
        verify(session).click("a.view-back");
    }

    @Test
    void warmUpTimeoutIsNotFatal() {
        RenderingSession session = mock(RenderingSession.class);
        doThrow(new NavigationTimeoutException("slow")).when(session).waitForSelector(eq("div.comics-end"), any());

        source.prepareNavigation(session, new Chapter(1, "One", ChapterHandle.elementId("c1")), Duration.ofSeconds(1));

        verify(session, never()).click("a.view-back");
    }

    @Test
    void blockedWarmUpClickIsNotFatal() {
        RenderingSession session = mock(RenderingSession.class);
        doThrow(new ElementClickInterceptedException("element click intercepted")).when(session).click("a[id=\"c1\"]");

        source.prepareNavigation(session, new Chapter(1, "One", ChapterHandle.elementId("c1")), Duration.ofSeconds(1));

        verify(session, never()).waitForSelector(eq("div.comics-end"), any());
    }

    @Test
    void warmUpPassesBrowserLossThrough() {
        RenderingSession session = mock(RenderingSession.class);
        doThrow(new FatalRunException("Browser session lost")).when(session).click("a[id=\"c1\"]");

        assertThatThrownBy(() -> source.prepareNavigation(session,
                new Chapter(1, "One", ChapterHandle.elementId("c1")), Duration.ofSeconds(1)))
                .isInstanceOf(FatalRunException.class);
    }
}
