package com.dkr.optimizer.service;

import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.PlanMode;
import com.dkr.optimizer.model.Tier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fewest-tracks overtake plan. Each ranked variant offers its best gain-per-difficulty tier;
 * the largest gains are taken first until the requirement is met. Not time-optimal.
 */
@Service
public class MinTracksPlannerService {

    private final DifficultyModel difficultyModel;

    public MinTracksPlannerService(DifficultyModel difficultyModel) {
        this.difficultyModel = difficultyModel;
    }

    public OvertakePlan plan(PlanningContext ctx, double currentAf, double targetAf, String targetUsername) {
        int required = ctx.requiredPositions(currentAf, targetAf);
        if (required == 0) {
            return ctx.finish(PlanMode.MIN_TRACKS, targetUsername, currentAf, targetAf, 0, List.of(), true);
        }

        List<OvertakePlanItem> items = new ArrayList<>(ctx.getNaItems());
        int gained = ctx.naGain();

        List<OvertakePlanItem> candidates = new ArrayList<>();
        for (PlanningContext.PlanGroup group : ctx.getGroups()) {
            candidates.add(group.item(bestReturn(group)));
        }
        candidates.sort(Comparator.comparingInt(OvertakePlanItem::getPositionsGained).reversed()
                .thenComparingInt(OvertakePlanItem::getTimeDeltaCs));

        for (OvertakePlanItem candidate : candidates) {
            if (gained >= required) break;
            items.add(candidate);
            gained += candidate.getPositionsGained();
        }
        return ctx.finish(PlanMode.MIN_TRACKS, targetUsername, currentAf, targetAf, required, items, gained >= required);
    }

    // highest positions / difficulty weight, first one on ties
    Tier bestReturn(PlanningContext.PlanGroup group) {
        Tier best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Tier tier : group.options()) {
            double score = tier.getPositionsGained() / difficultyModel.weight(tier.getTargetRank(), group.currentRank());
            if (score > bestScore) {
                bestScore = score;
                best = tier;
            }
        }
        return best;
    }
}
