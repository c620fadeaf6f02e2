package com.example.websearcher.agent;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbered history of tool observations that is fed back to the model on every turn.
 */
public final class Scratchpad {

    public static final String HEADER = "Previous action observations:\n";

    private static final Pattern LEADING_STEP = Pattern.compile("^(\\d+)");

    private Scratchpad() {
    }

    /**
     * @param previous history produced by an earlier call, or {@code null} for the first turn
     * @throws IllegalStateException if the last line of {@code previous} carries no step number
     */
    public static String append(String previous, String observation) {
        String text;
        int step;
        if (previous == null || previous.isEmpty()) {
            text = HEADER;
            step = 1;
        } else {
            text = previous;
            step = lastStep(previous) + 1;
        }
        return text + "\n" + step + ". " + observation;
    }

    private static int lastStep(String history) {
        String lastLine = history.substring(history.lastIndexOf('\n') + 1);
        Matcher matcher = LEADING_STEP.matcher(lastLine);
        if (!matcher.find()) {
            throw new IllegalStateException("Scratchpad is corrupted, last line has no step number: " + lastLine);
        }
        return Integer.parseInt(matcher.group(1));
    }
}
