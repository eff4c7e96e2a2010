package com.dkr.optimizer.model;

import com.dkr.optimizer.util.TimeCodec;

import java.util.List;

/**
 * A cross-variant selection of at most one tier per variant aimed at passing a rival's AF.
 * Time investment counts ranked items only, unweighted.
 */
public final class OvertakePlan {
    private final PlanMode mode;
    private final String targetUsername;
    private final double targetAf;
    private final double currentAf;
    private final int positionsNeeded;
    private final int positionsGained;
    private final int timeInvestmentCs;
    private final double newAf;
    private final boolean feasible;
    private final List<OvertakePlanItem> items;

    public OvertakePlan(PlanMode mode, String targetUsername, double targetAf, double currentAf,
                        int positionsNeeded, int positionsGained, int timeInvestmentCs, double newAf,
                        boolean feasible, List<OvertakePlanItem> items) {
        this.mode = mode;
        this.targetUsername = targetUsername;
        this.targetAf = targetAf;
        this.currentAf = currentAf;
        this.positionsNeeded = positionsNeeded;
        this.positionsGained = positionsGained;
        this.timeInvestmentCs = timeInvestmentCs;
        this.newAf = newAf;
        this.feasible = feasible;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public PlanMode getMode() { return mode; }
    public String getTargetUsername() { return targetUsername; }
    public double getTargetAf() { return targetAf; }
    public double getCurrentAf() { return currentAf; }
    public double getAfGap() { return currentAf - targetAf; }
    public int getPositionsNeeded() { return positionsNeeded; }
    public int getPositionsGained() { return positionsGained; }
    public int getTimeInvestmentCs() { return timeInvestmentCs; }
    public String getTimeInvestment() { return TimeCodec.format(timeInvestmentCs); }
    public double getNewAf() { return newAf; }
    public boolean isFeasible() { return feasible; }
    public List<OvertakePlanItem> getItems() { return items; }
}
