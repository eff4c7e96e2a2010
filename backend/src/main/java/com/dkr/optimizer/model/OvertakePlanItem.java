package com.dkr.optimizer.model;

import com.dkr.optimizer.util.TimeCodec;

/**
 * One selected tier inside an {@link OvertakePlan}.
 */
public final class OvertakePlanItem {
    private final TrackVariant variant;
    private final String trackName;
    private final boolean na;
    private final int currentRank;
    private final int currentTimeCs;
    private final Tier tier;

    public OvertakePlanItem(TrackVariant variant, String trackName, boolean na,
                            int currentRank, int currentTimeCs, Tier tier) {
        this.variant = variant;
        this.trackName = trackName;
        this.na = na;
        this.currentRank = currentRank;
        this.currentTimeCs = currentTimeCs;
        this.tier = tier;
    }

    public TrackVariant getVariant() { return variant; }
    public String getTrackName() { return trackName; }
    public boolean isNa() { return na; }
    public int getCurrentRank() { return currentRank; }
    public int getCurrentTimeCs() { return currentTimeCs; }
    public String getCurrentTime() { return TimeCodec.formatOrNa(currentTimeCs); }

    public int getNewRank() { return tier.getTargetRank(); }
    public int getTargetTimeCs() { return tier.getTargetTimeCs(); }
    public String getTargetTime() { return TimeCodec.format(tier.getTargetTimeCs()); }
    public int getOpponentTimeCs() { return tier.getOpponentTimeCs(); }
    public String getOpponentTime() { return TimeCodec.format(tier.getOpponentTimeCs()); }
    public int getPositionsGained() { return tier.getPositionsGained(); }
    public double getAfImprovement() { return tier.getAfImprovement(); }
    public int getTimeDeltaCs() { return tier.getTimeDeltaCs(); }
    public String getTimeDelta() { return TimeCodec.formatOrNa(tier.getTimeDeltaCs()); }
    public Efficiency getEfficiency() { return tier.getEfficiency(); }
}
