package com.example.websearcher.agent;

/**
 * The decision-making model. Returns the raw text of its answer; parsing is done by
 * {@link ActionParser}.
 */
@FunctionalInterface
public interface Oracle {

    String predict(AgentPrompt prompt);
}
