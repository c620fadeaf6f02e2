package com.example.websearcher.browser;

import com.microsoft.playwright.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * {@link BrowsingContext} over a Playwright {@link Page}. Every driver call holds the
 * lock shared by all pages of the same Playwright instance.
 */
public class PlaywrightBrowsingContext implements BrowsingContext {

    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowsingContext.class);

    private final Page page;
    private final Lock driverLock;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile String url;

    public PlaywrightBrowsingContext(Page page, Lock driverLock) {
        this.page = page;
        this.driverLock = driverLock;
        this.url = withDriver(page::url);
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public void navigate(String target) {
        run(() -> page.navigate(target));
    }

    @Override
    public void goBack() {
        run(page::goBack);
    }

    @Override
    public Object evaluate(String script) {
        return withDriver(() -> page.evaluate(script));
    }

    @Override
    public byte[] screenshot() {
        return withDriver(page::screenshot);
    }

    @Override
    public void click(double x, double y) {
        run(() -> page.mouse().click(x, y));
    }

    @Override
    public void type(String text) {
        run(() -> page.keyboard().type(text));
    }

    @Override
    public void press(String key) {
        run(() -> page.keyboard().press(key));
    }

    @Override
    public void scroll(double x, double y, double deltaY) {
        run(() -> {
            page.mouse().move(x, y);
            page.mouse().wheel(0, deltaY);
        });
    }

    @Override
    public void pause(Duration duration) throws InterruptedException {
        // plain sleep, the driver lock must stay free for other sessions
        Thread.sleep(duration.toMillis());
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        driverLock.lock();
        try {
            page.close();
        } finally {
            url = null;
            driverLock.unlock();
        }
    }

    private void run(Runnable action) {
        withDriver(() -> {
            action.run();
            return null;
        });
    }

    private <T> T withDriver(Supplier<T> call) {
        if (released.get()) {
            throw new IllegalStateException("Browsing context has been released");
        }
        driverLock.lock();
        try {
            T value = call.get();
            url = page.url();
            return value;
        } finally {
            driverLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "PlaywrightBrowsingContext{url=" + url + "}";
    }

    static void closeQuietly(Page page) {
        try {
            page.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing page: {}", e.getMessage());
        }
    }
}
