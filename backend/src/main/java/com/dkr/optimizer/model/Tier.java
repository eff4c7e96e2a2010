package com.dkr.optimizer.model;

import com.dkr.optimizer.util.TimeCodec;

/**
 * One reachable climb on a variant: the rank to take, the time that takes it and what it is worth.
 */
public final class Tier {
    private final int targetRank;
    private final int opponentTimeCs;
    private final int targetTimeCs;    // opponent - 1cs, beating rather than tying
    private final int positionsGained;
    private final double afImprovement;
    private final int timeDeltaCs;     // current time - target time
    private final Efficiency efficiency;

    public Tier(int targetRank, int opponentTimeCs, int targetTimeCs, int positionsGained,
                double afImprovement, int timeDeltaCs, Efficiency efficiency) {
        this.targetRank = targetRank;
        this.opponentTimeCs = opponentTimeCs;
        this.targetTimeCs = targetTimeCs;
        this.positionsGained = positionsGained;
        this.afImprovement = afImprovement;
        this.timeDeltaCs = timeDeltaCs;
        this.efficiency = efficiency;
    }

    public int getTargetRank() { return targetRank; }
    public int getOpponentTimeCs() { return opponentTimeCs; }
    public int getTargetTimeCs() { return targetTimeCs; }
    public int getPositionsGained() { return positionsGained; }
    public double getAfImprovement() { return afImprovement; }
    public int getTimeDeltaCs() { return timeDeltaCs; }
    public Efficiency getEfficiency() { return efficiency; }

    public String getOpponentTime() { return TimeCodec.format(opponentTimeCs); }
    public String getTargetTime() { return TimeCodec.format(targetTimeCs); }
    public String getTimeDelta() { return TimeCodec.format(timeDeltaCs); }

    @Override
    public String toString() {
        return "Tier{rank=" + targetRank + ", +" + positionsGained + ", delta=" + timeDeltaCs + "cs}";
    }
}
