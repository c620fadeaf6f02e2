package com.example.websearcher.service;

import com.example.websearcher.agent.DecisionGraph;
import com.example.websearcher.browser.BrowsingContext;
import lombok.Value;

/**
 * The page and agent owned by one session.
 */
@Value
public class SessionResources {
    BrowsingContext browsingContext;
    DecisionGraph decisionGraph;

    /**
     * Releases the graph, then the page. The page is released even if the graph
     * fails; the first failure is rethrown.
     */
    public void release() {
        RuntimeException failure = null;
        try {
            decisionGraph.release();
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            browsingContext.release();
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
