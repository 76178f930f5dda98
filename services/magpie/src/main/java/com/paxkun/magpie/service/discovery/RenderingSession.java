package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.exception.NavigationTimeoutException;

import java.time.Duration;

/**
 * The capabilities discovery needs from a live, script-running browser page.
 * A session holds one view; callers must not use it from more than one thread.
 * <p>
 * Methods throw {@link NavigationTimeoutException} when the page does not reach the
 * requested state in time or an action on it fails, and {@link FatalRunException}
 * when the engine itself is gone.
 */
public interface RenderingSession extends AutoCloseable {

    void navigate(String url);

    /**
     * Activates the first element matching {@code selector}, waiting for it to become clickable.
     */
    void click(String selector);

    void reload();

    String currentUrl();

    /**
     * Markup of the whole current document.
     */
    String pageSource();

    /**
     * Inner markup of the first element matching {@code selector}.
     */
    String innerHtml(String selector);

    void waitForSelector(String selector, Duration timeout);

    @Override
    void close();
}
