package com.example.websearcher.agent;

/**
 * Agent bound to one browsing context. A graph is owned by a single session and
 * runs at most one stream at a time.
 */
public interface DecisionGraph {

    /**
     * Starts working on a question. The returned stream is consumed by one thread.
     */
    DecisionStream stream(String question);

    void release();
}
