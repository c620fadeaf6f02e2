package com.example.websearcher.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the raw text of one model response into an {@link AgentAction}.
 *
 * <p>The model is expected to end its response with a line such as
 * {@code Action: Type [3]; [hello world]}. Anything else is answered with a
 * {@link AgentAction.RetryRequested}; this method never throws.
 */
public final class ActionParser {

    public static final String ACTION_PREFIX = "Action: ";
    static final String PARSE_FAILURE = "Could not parse LLM Output: ";

    private ActionParser() {
    }

    public static AgentAction parse(String text) {
        String actionBlock = lastNonEmptyLine(text);
        if (actionBlock == null || !actionBlock.startsWith(ACTION_PREFIX)) {
            return retry(text);
        }

        String[] split = actionBlock.substring(ACTION_PREFIX.length()).strip().split("\\s+", 2);
        String action = split[0].strip();
        if (action.isEmpty()) {
            return retry(text);
        }
        List<String> args = split.length > 1 ? parseArgs(split[1]) : null;

        if (isAnswer(action)) {
            return new AgentAction.Answer(args);
        }
        return new AgentAction.ToolCall(action, args);
    }

    private static AgentAction retry(String text) {
        return new AgentAction.RetryRequested(PARSE_FAILURE + text);
    }

    // "ANSWER;" is what the prompt format produces, the separator ends up on the name
    private static boolean isAnswer(String action) {
        String name = action.endsWith(";") ? action.substring(0, action.length() - 1) : action;
        return AgentAction.ANSWER.equals(name);
    }

    private static List<String> parseArgs(String input) {
        List<String> args = new ArrayList<>();
        for (String piece : input.strip().split(";", -1)) {
            args.add(unbracket(piece.strip()));
        }
        return args;
    }

    private static String unbracket(String arg) {
        String value = arg;
        if (value.startsWith("[")) {
            value = value.substring(1);
        }
        if (value.endsWith("]")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String lastNonEmptyLine(String text) {
        if (text == null) {
            return null;
        }
        String[] lines = text.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i].stripTrailing();
            }
        }
        return null;
    }
}
