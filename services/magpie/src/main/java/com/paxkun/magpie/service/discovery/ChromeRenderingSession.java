package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.exception.NavigationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * {@link RenderingSession} backed by one Chrome window driven through Selenium.
 * <p>
 * Author: Pax
 */
@Slf4j
public class ChromeRenderingSession implements RenderingSession {

    private static final List<String> BROWSER_LOST_MARKERS = List.of(
            "chrome not reachable",
            "disconnected: not connected to devtools",
            "session deleted because of page crash",
            "target window already closed");

    private final WebDriver driver;
    private final Duration defaultTimeout;

    public ChromeRenderingSession(WebDriver driver, Duration defaultTimeout) {
        this.driver = driver;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public void navigate(String url) {
        guard("navigate to " + url, () -> {
            driver.get(url);
            return null;
        });
    }

    @Override
    public void click(String selector) {
        guard("click " + selector, () -> {
            WebElement element = new WebDriverWait(driver, defaultTimeout)
                    .until(ExpectedConditions.elementToBeClickable(By.cssSelector(selector)));
            element.click();
            return null;
        });
    }

    @Override
    public void reload() {
        guard("reload", () -> {
            driver.navigate().refresh();
            return null;
        });
    }

    @Override
    public String currentUrl() {
        return guard("read current URL", driver::getCurrentUrl);
    }

    @Override
    public String pageSource() {
        return guard("read page source", driver::getPageSource);
    }

    @Override
    public String innerHtml(String selector) {
        return guard("read " + selector, () -> {
            WebElement element = new WebDriverWait(driver, defaultTimeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selector)));
            return element.getAttribute("innerHTML");
        });
    }

    @Override
    public void waitForSelector(String selector, Duration timeout) {
        guard("wait for " + selector, () -> {
            new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selector)));
            return null;
        });
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser cleanly: {}", e.getMessage());
        }
    }

    /**
     * Timeouts and per-action driver failures (blocked clicks, stale elements, failed page
     * loads) become {@link NavigationTimeoutException} so callers can reload and retry.
     * A browser that is gone becomes {@link FatalRunException}.
     */
    private <T> T guard(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (TimeoutException e) {
            throw new NavigationTimeoutException("Timed out trying to " + action, e);
        } catch (WebDriverException e) {
            if (isBrowserLost(e)) {
                throw new FatalRunException("Browser session lost while trying to " + action, e);
            }
            throw new NavigationTimeoutException("Failed to " + action + ": " + e.getRawMessage(), e);
        }
    }

    static boolean isBrowserLost(WebDriverException e) {
        if (e instanceof NoSuchSessionException || e instanceof UnreachableBrowserException) {
            return true;
        }
        String message = e.getRawMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : BROWSER_LOST_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
