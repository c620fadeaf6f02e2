package com.example.websearcher.browser;

import java.time.Duration;

/**
 * The page a session drives. Only the query loop of the owning session calls the
 * interaction methods; {@link #url()} may be read from any thread.
 */
public interface BrowsingContext {

    /** Last URL observed by the driver, or {@code null} once released. */
    String url();

    void navigate(String url);

    void goBack();

    Object evaluate(String script);

    byte[] screenshot();

    void click(double x, double y);

    void type(String text);

    void press(String key);

    /** Moves the pointer to the given point and turns the mouse wheel. */
    void scroll(double x, double y, double deltaY);

    void pause(Duration duration) throws InterruptedException;

    /** Closes the page. Idempotent. */
    void release();
}
