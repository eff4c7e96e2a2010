package com.dkr.optimizer.util;

/**
 * Raised when a leaderboard time string is not in the {@code MM:SS:CC} shape.
 */
public class TimeFormatException extends IllegalArgumentException {

    private final String input;

    public TimeFormatException(String input, String message) {
        super(message);
        this.input = input;
    }

    public TimeFormatException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() { return input; }
}
