package com.dkr.optimizer.model;

/**
 * A row of a variant leaderboard. Placeholder rows carry a synthetic default time and never compete.
 */
public final class LeaderboardEntry {
    private final int rank;
    private final String username;
    private final String displayName;
    private final int timeCs;
    private final boolean placeholder;

    public LeaderboardEntry(int rank, String username, String displayName, int timeCs, boolean placeholder) {
        this.rank = rank;
        this.username = username;
        this.displayName = displayName != null ? displayName : username;
        this.timeCs = timeCs;
        this.placeholder = placeholder;
    }

    public static LeaderboardEntry real(int rank, String username, int timeCs) {
        return new LeaderboardEntry(rank, username, username, timeCs, false);
    }

    public LeaderboardEntry withTime(int newTimeCs) {
        return new LeaderboardEntry(rank, username, displayName, newTimeCs, placeholder);
    }

    public LeaderboardEntry withRank(int newRank) {
        return new LeaderboardEntry(newRank, username, displayName, timeCs, placeholder);
    }

    public boolean isUser(String name) {
        return name != null && username != null && username.equalsIgnoreCase(name);
    }

    public int getRank() { return rank; }
    public String getUsername() { return username; }
    public String getDisplayName() { return displayName; }
    public int getTimeCs() { return timeCs; }
    public boolean isPlaceholder() { return placeholder; }
}
