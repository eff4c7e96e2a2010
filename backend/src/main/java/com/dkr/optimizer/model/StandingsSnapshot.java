package com.dkr.optimizer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable input of one optimizer run: the player's standings plus every fetched leaderboard.
 * Variants without a leaderboard are out of scope and do not count towards {@link #getTotalTracks()}.
 */
public final class StandingsSnapshot {
    private final String username;
    private final List<PlayerStanding> standings;
    private final Map<TrackVariant, List<LeaderboardEntry>> leaderboards;

    public StandingsSnapshot(String username,
                             List<PlayerStanding> standings,
                             Map<TrackVariant, List<LeaderboardEntry>> leaderboards) {
        if (username == null || username.isBlank()) throw new IllegalArgumentException("username is required");
        this.username = username;
        this.standings = List.copyOf(Objects.requireNonNull(standings, "standings"));
        Map<TrackVariant, List<LeaderboardEntry>> copy = new LinkedHashMap<>();
        Objects.requireNonNull(leaderboards, "leaderboards").forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.leaderboards = Collections.unmodifiableMap(copy);
    }

    public String getUsername() { return username; }
    public List<PlayerStanding> getStandings() { return standings; }
    public Map<TrackVariant, List<LeaderboardEntry>> getLeaderboards() { return leaderboards; }

    public boolean hasLeaderboard(TrackVariant variant) {
        return leaderboards.containsKey(variant);
    }

    /** Entries for the variant, empty when no leaderboard exists. */
    public List<LeaderboardEntry> leaderboard(TrackVariant variant) {
        return leaderboards.getOrDefault(variant, List.of());
    }

    /** Entries without placeholders, in leaderboard order. */
    public List<LeaderboardEntry> realEntries(TrackVariant variant) {
        return leaderboard(variant).stream().filter(e -> !e.isPlaceholder()).toList();
    }

    public int getTotalTracks() { return leaderboards.size(); }
}
