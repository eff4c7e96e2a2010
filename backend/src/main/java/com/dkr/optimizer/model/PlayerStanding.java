package com.dkr.optimizer.model;

import java.util.Objects;

/**
 * The player's recorded result on one variant. Rank 0 together with {@code na} means no time submitted.
 */
public final class PlayerStanding {
    private final TrackVariant variant;
    private final String trackName;
    private final int rank;
    private final int timeCs; // 0 when N/A
    private final boolean na;

    public PlayerStanding(TrackVariant variant, String trackName, int rank, int timeCs, boolean na) {
        this.variant = Objects.requireNonNull(variant, "variant");
        this.trackName = trackName != null ? trackName : variant.trackSlug();
        this.rank = rank;
        this.timeCs = timeCs;
        this.na = na;
    }

    public static PlayerStanding na(TrackVariant variant, String trackName) {
        return new PlayerStanding(variant, trackName, 0, 0, true);
    }

    public PlayerStanding withResult(int newRank, int newTimeCs) {
        return new PlayerStanding(variant, trackName, newRank, newTimeCs, false);
    }

    public TrackVariant getVariant() { return variant; }
    public String getTrackName() { return trackName; }
    public int getRank() { return rank; }
    public int getTimeCs() { return timeCs; }
    public boolean isNa() { return na; }
}
