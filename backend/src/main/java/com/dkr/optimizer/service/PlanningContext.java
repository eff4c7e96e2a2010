package com.dkr.optimizer.service;

import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.PlanMode;
import com.dkr.optimizer.model.Tier;
import com.dkr.optimizer.model.TrackVariant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-track option sets shared by both overtake planners. Built once per run.
 * N/A items are always taken; each ranked group offers mutually exclusive tiers.
 */
public final class PlanningContext {

    private final int totalTracks;
    private final double requirementEpsilon;
    private final List<OvertakePlanItem> naItems;
    private final List<PlanGroup> groups;

    public PlanningContext(int totalTracks, double requirementEpsilon,
                           List<OvertakePlanItem> naItems, List<PlanGroup> groups) {
        if (totalTracks <= 0) throw new IllegalArgumentException("totalTracks must be positive");
        this.totalTracks = totalTracks;
        this.requirementEpsilon = requirementEpsilon;
        this.naItems = List.copyOf(naItems);
        this.groups = List.copyOf(groups);
    }

    /** A ranked variant and its tiers, ordered by positions gained. */
    public record PlanGroup(TrackVariant variant, String trackName, int currentRank, int currentTimeCs, List<Tier> options) {
        public PlanGroup {
            options = List.copyOf(options);
            if (options.isEmpty()) throw new IllegalArgumentException("A plan group needs at least one option: " + variant);
        }

        public int maxGain() {
            return options.stream().mapToInt(Tier::getPositionsGained).max().orElse(0);
        }

        public OvertakePlanItem item(Tier tier) {
            return new OvertakePlanItem(variant, trackName, false, currentRank, currentTimeCs, tier);
        }
    }

    public int getTotalTracks() { return totalTracks; }
    public List<OvertakePlanItem> getNaItems() { return naItems; }
    public List<PlanGroup> getGroups() { return groups; }

    public int naGain() {
        return naItems.stream().mapToInt(OvertakePlanItem::getPositionsGained).sum();
    }

    public int maxRankedGain() {
        return groups.stream().mapToInt(PlanGroup::maxGain).sum();
    }

    /**
     * Positions needed to strictly pass the rival: {@code ceil(gap * totalTracks + eps)}, 0 when already ahead.
     */
    public int requiredPositions(double currentAf, double targetAf) {
        double gap = currentAf - targetAf;
        if (gap <= 0) return 0;
        return (int) Math.ceil(gap * totalTracks + requirementEpsilon);
    }

    OvertakePlan finish(PlanMode mode, String targetUsername, double currentAf, double targetAf,
                        int required, List<OvertakePlanItem> items, boolean feasible) {
        List<OvertakePlanItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(OvertakePlanItem::getAfImprovement).reversed());
        int gained = sorted.stream().mapToInt(OvertakePlanItem::getPositionsGained).sum();
        int timeCs = sorted.stream().filter(i -> !i.isNa()).mapToInt(OvertakePlanItem::getTimeDeltaCs).sum();
        double newAf = currentAf - (double) gained / totalTracks;
        return new OvertakePlan(mode, targetUsername, targetAf, currentAf, required, gained, timeCs, newAf, feasible, sorted);
    }
}
