package com.example.websearcher.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared Chromium instance, launched on first use. Playwright objects are not
 * thread-safe, so all pages created here share one driver lock.
 */
@Component
public class BrowserProvider {

    private static final Logger logger = LoggerFactory.getLogger(BrowserProvider.class);

    private final Lock driverLock = new ReentrantLock();
    private final boolean headless;

    private Playwright playwright;
    private Browser browser;
    private boolean shutdown;
    private volatile boolean running;

    public BrowserProvider(@Value("${app.browser.headless:true}") boolean headless) {
        this.headless = headless;
    }

    /**
     * Opens a new page and navigates it to {@code startUrl}.
     *
     * @throws IllegalStateException if the provider has been shut down
     * @throws com.microsoft.playwright.PlaywrightException if the browser cannot be launched or the page fails to load
     */
    public BrowsingContext openPage(String startUrl) {
        Page page;
        driverLock.lock();
        try {
            page = ensureBrowser().newPage();
            try {
                page.navigate(startUrl);
            } catch (RuntimeException e) {
                PlaywrightBrowsingContext.closeQuietly(page);
                throw e;
            }
        } finally {
            driverLock.unlock();
        }
        return new PlaywrightBrowsingContext(page, driverLock);
    }

    /** Reads a flag only; never waits for the driver lock. */
    public boolean isRunning() {
        return running;
    }

    private Browser ensureBrowser() {
        if (shutdown) {
            throw new IllegalStateException("Browser has been shut down");
        }
        if (browser == null || !browser.isConnected()) {
            logger.info("Launching Chromium (headless={})", headless);
            if (playwright == null) {
                playwright = Playwright.create();
            }
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            browser.onDisconnected(closed -> {
                running = false;
                logger.info("Browser disconnected");
            });
            running = true;
        }
        return browser;
    }

    @PreDestroy
    public void shutdown() {
        driverLock.lock();
        try {
            shutdown = true;
            running = false;
            if (browser != null) {
                try {
                    browser.close();
                } catch (RuntimeException e) {
                    logger.warn("Error closing browser: {}", e.getMessage());
                }
            }
            if (playwright != null) {
                playwright.close();
            }
            browser = null;
            playwright = null;
            logger.info("Browser stopped");
        } finally {
            driverLock.unlock();
        }
    }
}
