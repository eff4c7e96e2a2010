package com.dkr.optimizer.util;

/**
 * Converts leaderboard times to and from centiseconds.
 * All arithmetic in the optimizer is done on integer centiseconds.
 */
public final class TimeCodec {

    public static final int CS_PER_SECOND = 100;
    public static final int CS_PER_MINUTE = 6000;

    private TimeCodec() {}

    /**
     * Parses {@code MM:SS:CC} (a period is accepted in place of either colon) into centiseconds.
     * Field ranges are not checked beyond integer parsing.
     */
    public static int parse(String text) {
        if (text == null) throw new TimeFormatException(null, "Time text is required");
        String[] parts = text.trim().split("[:.]", -1);
        if (parts.length != 3) {
            throw new TimeFormatException(text, "Invalid time format: '" + text + "', expected MM:SS:CC");
        }
        try {
            int minutes = Integer.parseInt(parts[0]);
            int seconds = Integer.parseInt(parts[1]);
            int centis = Integer.parseInt(parts[2]);
            return minutes * CS_PER_MINUTE + seconds * CS_PER_SECOND + centis;
        } catch (NumberFormatException ex) {
            throw new TimeFormatException(text, "Non-numeric field in time '" + text + "'", ex);
        }
    }

    /** Renders centiseconds as {@code MM:SS.CC}. */
    public static String format(int cs) {
        int minutes = cs / CS_PER_MINUTE;
        int remainder = cs % CS_PER_MINUTE;
        int seconds = remainder / CS_PER_SECOND;
        int centis = remainder % CS_PER_SECOND;
        return String.format("%02d:%02d.%02d", minutes, seconds, centis);
    }

    // "N/A" when there is no recorded time
    public static String formatOrNa(int cs) {
        return cs > 0 ? format(cs) : "N/A";
    }
}
