package com.example.websearcher.agent;

import com.example.websearcher.browser.BrowsingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Labels the interactive elements of a page, takes a screenshot with the labels
 * visible and removes them again.
 */
public class PageAnnotator {

    private static final Logger logger = LoggerFactory.getLogger(PageAnnotator.class);

    private final String markPageScript;
    private final int attempts;
    private final Duration retryDelay;

    public PageAnnotator(String markPageScript, int attempts, Duration retryDelay) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        this.markPageScript = markPageScript;
        this.attempts = attempts;
        this.retryDelay = retryDelay;
    }

    public PageAnnotation annotate(BrowsingContext page) throws InterruptedException {
        page.evaluate(markPageScript);
        List<BoundingBox> boxes = markPage(page);
        byte[] screenshot = page.screenshot();
        page.evaluate("unmarkPage()");
        return new PageAnnotation(screenshot, boxes);
    }

    // the page may still be loading right after a navigation
    private List<BoundingBox> markPage(BrowsingContext page) throws InterruptedException {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return toBoxes(page.evaluate("markPage()"));
            } catch (RuntimeException e) {
                last = e;
                logger.debug("markPage attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    page.pause(retryDelay);
                }
            }
        }
        throw last;
    }

    private static List<BoundingBox> toBoxes(Object raw) {
        if (!(raw instanceof List)) {
            throw new IllegalStateException("markPage() returned " + raw);
        }
        List<BoundingBox> boxes = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            boxes.add(BoundingBox.fromScript((Map<?, ?>) item));
        }
        return boxes;
    }
}
