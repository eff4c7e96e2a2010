package com.dkr.optimizer.service;

import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.PlanMode;
import com.dkr.optimizer.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Minimum-time overtake plan: a multi-choice knapsack over the ranked variants, picking at most one tier
 * per variant so that the gained positions reach the requirement at the lowest difficulty-weighted cost.
 */
@Service
public class OvertakePlannerService {

    private static final Logger log = LoggerFactory.getLogger(OvertakePlannerService.class);

    private static final int SKIPPED = -1;

    private final DifficultyModel difficultyModel;

    public OvertakePlannerService(DifficultyModel difficultyModel) {
        this.difficultyModel = difficultyModel;
    }

    public OvertakePlan plan(PlanningContext ctx, double currentAf, double targetAf, String targetUsername) {
        int required = ctx.requiredPositions(currentAf, targetAf);
        if (required == 0) {
            return ctx.finish(PlanMode.MIN_TIME, targetUsername, currentAf, targetAf, 0, List.of(), true);
        }

        List<OvertakePlanItem> items = new ArrayList<>(ctx.getNaItems());
        int remaining = required - ctx.naGain();
        if (remaining <= 0) {
            return ctx.finish(PlanMode.MIN_TIME, targetUsername, currentAf, targetAf, required, items, true);
        }

        List<PlanningContext.PlanGroup> groups = ctx.getGroups();
        int maxGain = ctx.maxRankedGain();
        boolean feasible = maxGain >= remaining;
        if (!feasible) {
            log.info("[Overtake][MinTime] target={} needs {} more positions, only {} reachable", targetUsername, remaining, maxGain);
        }

        List<OvertakePlanItem> ranked = feasible
                ? solve(groups, maxGain, remaining)
                : solve(groups, maxGain, maxGain);
        items.addAll(ranked);
        return ctx.finish(PlanMode.MIN_TIME, targetUsername, currentAf, targetAf, required, items, feasible);
    }

    /**
     * Runs the knapsack and backtracks the cheapest state with at least {@code floor} positions.
     */
    List<OvertakePlanItem> solve(List<PlanningContext.PlanGroup> groups, int maxGain, int floor) {
        int width = maxGain + 1;
        int groupCount = groups.size();

        double[] cost = new double[width];
        Arrays.fill(cost, Double.POSITIVE_INFINITY);
        cost[0] = 0.0;
        // choice[g * width + p]: option index taken by group g to reach p, or SKIPPED
        int[] choice = new int[groupCount * width];

        for (int g = 0; g < groupCount; g++) {
            PlanningContext.PlanGroup group = groups.get(g);
            List<Tier> options = group.options();
            int[] gains = new int[options.size()];
            double[] weighted = new double[options.size()];
            for (int o = 0; o < options.size(); o++) {
                gains[o] = options.get(o).getPositionsGained();
                weighted[o] = difficultyModel.weightedCost(options.get(o), group.currentRank());
            }

            double[] next = cost.clone();
            int base = g * width;
            Arrays.fill(choice, base, base + width, SKIPPED);
            for (int p = 0; p < width; p++) {
                if (cost[p] == Double.POSITIVE_INFINITY) continue;
                for (int o = 0; o < gains.length; o++) {
                    int q = p + gains[o];
                    if (q >= width) continue;
                    double c = cost[p] + weighted[o];
                    if (c < next[q]) {
                        next[q] = c;
                        choice[base + q] = o;
                    }
                }
            }
            cost = next;
        }

        int best = -1;
        for (int p = floor; p < width; p++) {
            if (cost[p] == Double.POSITIVE_INFINITY) continue;
            if (best < 0 || cost[p] < cost[best]) best = p;
        }
        if (best < 0) {
            throw new PlanningDefectException("No knapsack state reaches " + floor + " positions although "
                    + maxGain + " are available across " + groupCount + " groups");
        }

        List<OvertakePlanItem> picked = new ArrayList<>();
        int p = best;
        for (int g = groupCount - 1; g >= 0; g--) {
            int o = choice[g * width + p];
            if (o == SKIPPED) continue;
            PlanningContext.PlanGroup group = groups.get(g);
            Tier tier = group.options().get(o);
            picked.add(group.item(tier));
            p -= tier.getPositionsGained();
        }
        if (p != 0) {
            throw new PlanningDefectException("Backtracking ended at state " + p + " instead of 0");
        }
        log.debug("[Overtake][MinTime] state={} weightedCost={} picks={}", best, cost[best], picked.size());
        return picked;
    }
}
