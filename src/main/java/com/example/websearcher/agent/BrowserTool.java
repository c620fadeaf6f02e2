package com.example.websearcher.agent;

import com.example.websearcher.browser.BrowsingContext;

import java.util.List;

/**
 * A browser action the model can choose. Returns the observation recorded in the
 * scratchpad.
 */
@FunctionalInterface
public interface BrowserTool {

    String execute(BrowsingContext page, List<BoundingBox> boxes, List<String> args) throws InterruptedException;
}
