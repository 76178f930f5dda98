package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.config.NavigationSettings;
import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Launches Chrome for a run. The driver binary is located by Selenium Manager.
 */
@Component
@RequiredArgsConstructor
public class ChromeRenderingSessionFactory implements RenderingSessionFactory {

    private static final Duration PAGE_LOAD_TIMEOUT = Duration.ofSeconds(60);

    private final NavigationSettings settings;
    private final LoggerService logger;

    @Override
    public RenderingSession open() {
        ChromeOptions options = new ChromeOptions();
        if (settings.headless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage");

        try {
            ChromeDriver driver = new ChromeDriver(options);
            driver.manage().timeouts().pageLoadTimeout(PAGE_LOAD_TIMEOUT);
            logger.info("BROWSER", "Chrome session started (headless=" + settings.headless() + ")");
            return new ChromeRenderingSession(driver, settings.timeout());
        } catch (WebDriverException e) {
            throw new FatalRunException("Could not start Chrome: " + e.getMessage(), e);
        }
    }
}
