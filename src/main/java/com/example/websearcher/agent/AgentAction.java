package com.example.websearcher.agent;

import lombok.Value;

import java.util.List;

/**
 * One decision of the agent: a final answer, a browser tool invocation, or a
 * request to ask the model again because its output could not be understood.
 */
public interface AgentAction {

    String ANSWER = "ANSWER";
    String RETRY = "retry";

    String getName();

    /**
     * Human readable form used as the session's current action.
     */
    String describe();

    @Value
    class Answer implements AgentAction {
        List<String> args;

        @Override
        public String getName() {
            return ANSWER;
        }

        /** First argument, or {@code null} when the model gave none. */
        public String result() {
            return args == null || args.isEmpty() ? null : args.get(0);
        }

        @Override
        public String describe() {
            return ANSWER + ": " + args;
        }
    }

    @Value
    class ToolCall implements AgentAction {
        String name;
        List<String> args;

        @Override
        public String describe() {
            return name + ": " + args;
        }
    }

    @Value
    class RetryRequested implements AgentAction {
        String diagnostic;

        @Override
        public String getName() {
            return RETRY;
        }

        @Override
        public String describe() {
            return RETRY + ": " + diagnostic;
        }
    }
}
