package com.example.websearcher.agent;

import com.example.websearcher.browser.BrowsingContext;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The tools offered to the model, keyed by the action name it uses.
 */
public final class BrowserTools {

    public static final String CLICK = "Click";
    public static final String TYPE = "Type";
    public static final String SCROLL = "Scroll";
    public static final String WAIT = "Wait";
    public static final String GO_BACK = "GoBack";
    public static final String SEARCH = "Google";

    static final int WINDOW_SCROLL_PIXELS = 500;
    static final int ELEMENT_SCROLL_PIXELS = 200;

    private BrowserTools() {
    }

    public static Map<String, BrowserTool> defaults(String searchUrl, Duration waitTime) {
        Map<String, BrowserTool> tools = new LinkedHashMap<>();
        tools.put(CLICK, BrowserTools::click);
        tools.put(TYPE, BrowserTools::typeText);
        tools.put(SCROLL, BrowserTools::scroll);
        tools.put(WAIT, (page, boxes, args) -> {
            page.pause(waitTime);
            return "Waited for " + waitTime.toSeconds() + "s.";
        });
        tools.put(GO_BACK, (page, boxes, args) -> {
            page.goBack();
            return "Navigated back a page to " + page.url() + ".";
        });
        tools.put(SEARCH, (page, boxes, args) -> {
            page.navigate(searchUrl);
            return "Navigated to " + searchUrl + ".";
        });
        return Collections.unmodifiableMap(tools);
    }

    static String click(BrowsingContext page, List<BoundingBox> boxes, List<String> args) {
        if (args == null || args.size() != 1) {
            return "Failed to click bounding box labeled as number " + args;
        }
        int label = Integer.parseInt(args.get(0).strip());
        BoundingBox box = box(boxes, label);
        page.click(box.getX(), box.getY());
        return "Clicked " + label;
    }

    static String typeText(BrowsingContext page, List<BoundingBox> boxes, List<String> args) {
        if (args == null || args.size() != 2) {
            return "Failed to type in element from bounding box labeled as number " + args;
        }
        int label = Integer.parseInt(args.get(0).strip());
        String text = args.get(1);
        BoundingBox box = box(boxes, label);
        page.click(box.getX(), box.getY());
        page.press("ControlOrMeta+A");
        page.press("Backspace");
        page.type(text);
        page.press("Enter");
        return "Typed " + text + " and submitted";
    }

    static String scroll(BrowsingContext page, List<BoundingBox> boxes, List<String> args) {
        if (args == null || args.size() != 2) {
            return "Failed to scroll due to incorrect arguments.";
        }
        String target = args.get(0).strip();
        String direction = args.get(1).strip().toLowerCase(Locale.ROOT);
        boolean up = "up".equals(direction);

        if ("WINDOW".equalsIgnoreCase(target)) {
            int amount = up ? -WINDOW_SCROLL_PIXELS : WINDOW_SCROLL_PIXELS;
            page.evaluate("window.scrollBy(0, " + amount + ")");
            return "Scrolled " + direction + " in window";
        }
        BoundingBox box = box(boxes, Integer.parseInt(target));
        page.scroll(box.getX(), box.getY(), up ? -ELEMENT_SCROLL_PIXELS : ELEMENT_SCROLL_PIXELS);
        return "Scrolled " + direction + " in element";
    }

    private static BoundingBox box(List<BoundingBox> boxes, int label) {
        if (label < 0 || label >= boxes.size()) {
            throw new IllegalArgumentException("No bounding box labeled " + label + " on the page");
        }
        return boxes.get(label);
    }
}
