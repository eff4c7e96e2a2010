package com.dkr.optimizer.model;

import com.dkr.optimizer.util.TimeCodec;

import java.util.List;

/**
 * All tiers found for one variant, ordered by positions gained, plus the most efficient pick.
 * No tiers means nothing to improve (already first, or nobody ahead).
 */
public final class Opportunity {
    private final TrackVariant variant;
    private final String trackName;
    private final int currentRank;
    private final int currentTimeCs; // 0 for N/A
    private final boolean na;
    private final List<Tier> tiers;
    private final Efficiency bestEfficiency;
    private final int bestTierIndex;

    public Opportunity(TrackVariant variant, String trackName, int currentRank, int currentTimeCs, boolean na,
                       List<Tier> tiers, Efficiency bestEfficiency, int bestTierIndex) {
        this.variant = variant;
        this.trackName = trackName;
        this.currentRank = currentRank;
        this.currentTimeCs = currentTimeCs;
        this.na = na;
        this.tiers = tiers == null ? List.of() : List.copyOf(tiers);
        this.bestEfficiency = bestEfficiency == null ? Efficiency.ZERO : bestEfficiency;
        this.bestTierIndex = bestTierIndex;
    }

    public static Opportunity empty(TrackVariant variant, String trackName, int currentRank, int currentTimeCs, boolean na) {
        return new Opportunity(variant, trackName, currentRank, currentTimeCs, na, List.of(), Efficiency.ZERO, 0);
    }

    public TrackVariant getVariant() { return variant; }
    public String getTrackName() { return trackName; }
    public int getCurrentRank() { return currentRank; }
    public int getCurrentTimeCs() { return currentTimeCs; }
    public String getCurrentTime() { return TimeCodec.formatOrNa(currentTimeCs); }
    public boolean isNa() { return na; }
    public List<Tier> getTiers() { return tiers; }
    public Efficiency getBestEfficiency() { return bestEfficiency; }
    public int getBestTierIndex() { return bestTierIndex; }

    public boolean hasTiers() { return !tiers.isEmpty(); }

    public Tier getBestTier() {
        return tiers.isEmpty() ? null : tiers.get(bestTierIndex);
    }
}
