package com.dkr.optimizer.service;

import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.PlanMode;
import com.dkr.optimizer.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OvertakePlannerServiceTest {

    private static final double EPS = 1e-9;

    private final DifficultyModel difficulty = new DifficultyModel(5.0);
    private final OvertakePlannerService planner = new OvertakePlannerService(difficulty);

    @Test
    void naGainsAreTakenAndCheapestRankedTierClosesTheRest() {
        int total = 10;
        PlanningContext ctx = new PlanningContext(total, EPS,
                List.of(Fixtures.naItem("na", 2, total)),
                List.of(Fixtures.group("ranked", 5, Fixtures.tier(4, 1, 50, total))));

        // gap * total = 2.5 -> 3 positions
        OvertakePlan plan = planner.plan(ctx, 5.0, 4.75, "rival");

        assertThat(plan.getMode()).isEqualTo(PlanMode.MIN_TIME);
        assertThat(plan.isFeasible()).isTrue();
        assertThat(plan.getPositionsNeeded()).isEqualTo(3);
        assertThat(plan.getPositionsGained()).isEqualTo(3);
        assertThat(plan.getTimeInvestmentCs()).isEqualTo(50);
        assertThat(plan.getItems()).hasSize(2);
        assertThat(plan.getItems()).filteredOn(i -> !i.isNa()).singleElement()
                .extracting(OvertakePlanItem::getTimeDeltaCs).isEqualTo(50);
        assertThat(plan.getNewAf()).isCloseTo(4.7, within(1e-12));
        assertThat(plan.getTargetUsername()).isEqualTo("rival");
    }

    @Test
    void exactAfTieStillNeedsOneMorePosition() {
        PlanningContext ctx = new PlanningContext(4, EPS, List.of(), List.of());
        assertThat(ctx.requiredPositions(5.0, 4.5)).isEqualTo(3);
    }

    @Test
    void alreadyAheadIsTriviallyFeasible() {
        PlanningContext ctx = new PlanningContext(10, EPS, List.of(Fixtures.naItem("na", 2, 10)), List.of());

        OvertakePlan plan = planner.plan(ctx, 4.0, 4.5, "rival");

        assertThat(plan.isFeasible()).isTrue();
        assertThat(plan.getItems()).isEmpty();
        assertThat(plan.getPositionsNeeded()).isZero();
        assertThat(plan.getNewAf()).isEqualTo(4.0);
    }

    @Test
    void naGainsAloneCanMeetTheRequirement() {
        int total = 10;
        PlanningContext ctx = new PlanningContext(total, EPS,
                List.of(Fixtures.naItem("na1", 2, total), Fixtures.naItem("na2", 1, total)),
                List.of(Fixtures.group("ranked", 5, Fixtures.tier(4, 1, 50, total))));

        OvertakePlan plan = planner.plan(ctx, 5.0, 4.75, "rival");

        assertThat(plan.isFeasible()).isTrue();
        assertThat(plan.getItems()).allMatch(OvertakePlanItem::isNa);
        assertThat(plan.getTimeInvestmentCs()).isZero();
    }

    @Test
    void infeasibleRequirementReturnsBestAttainableSelection() {
        int total = 20;
        PlanningContext ctx = new PlanningContext(total, EPS, List.of(), List.of(
                Fixtures.group("a", 10, Fixtures.tier(9, 1, 30, total), Fixtures.tier(8, 2, 70, total), Fixtures.tier(7, 3, 150, total)),
                Fixtures.group("b", 8, Fixtures.tier(7, 1, 20, total), Fixtures.tier(5, 3, 90, total))));

        // gap * total = 9.5 -> 10 positions, only 6 reachable
        OvertakePlan plan = planner.plan(ctx, 5.0, 4.525, "rival");

        assertThat(plan.isFeasible()).isFalse();
        assertThat(plan.getPositionsNeeded()).isEqualTo(10);
        assertThat(plan.getPositionsGained()).isEqualTo(6);
        assertThat(plan.getItems()).extracting(OvertakePlanItem::getPositionsGained).containsExactlyInAnyOrder(3, 3);
        assertThat(plan.getTimeInvestmentCs()).isEqualTo(240);
    }

    @Test
    void difficultyWeightSteersAwayFromClimbsToTheTop() {
        int total = 10;
        PlanningContext ctx = new PlanningContext(total, EPS, List.of(), List.of(
                Fixtures.group("near-top", 2, Fixtures.tier(1, 1, 100, total)),
                Fixtures.group("mid-pack", 50, Fixtures.tier(49, 1, 300, total))));

        OvertakePlan plan = planner.plan(ctx, 5.0, 4.95, "rival");

        assertThat(plan.getItems()).singleElement()
                .satisfies(i -> assertThat(i.getVariant().trackSlug()).isEqualTo("mid-pack"));
        // reported cost is raw, not weighted
        assertThat(plan.getTimeInvestmentCs()).isEqualTo(300);
    }

    @Test
    void itemsAreOrderedByAfImprovement() {
        int total = 10;
        PlanningContext ctx = new PlanningContext(total, EPS, List.of(Fixtures.naItem("na", 1, total)), List.of(
                Fixtures.group("a", 10, Fixtures.tier(9, 1, 10, total)),
                Fixtures.group("b", 10, Fixtures.tier(9, 1, 10, total), Fixtures.tier(7, 3, 40, total))));

        OvertakePlan plan = planner.plan(ctx, 5.0, 4.55, "rival");

        assertThat(plan.isFeasible()).isTrue();
        List<Double> afs = plan.getItems().stream().map(OvertakePlanItem::getAfImprovement).toList();
        for (int i = 1; i < afs.size(); i++) {
            assertThat(afs.get(i)).isLessThanOrEqualTo(afs.get(i - 1));
        }
    }

    @Test
    void unreachableStateIsReportedAsDefect() {
        List<PlanningContext.PlanGroup> groups = List.of(Fixtures.group("a", 5, Fixtures.tier(4, 1, 10, 10)));

        assertThatThrownBy(() -> planner.solve(groups, 1, 2))
                .isInstanceOf(PlanningDefectException.class)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void knapsackMatchesBruteForceOnSmallInstances() {
        Random rnd = new Random(20240917L);
        int total = 12;
        for (int instance = 0; instance < 30; instance++) {
            List<PlanningContext.PlanGroup> groups = new ArrayList<>();
            int maxGain = 0;
            for (int g = 0; g < 4; g++) {
                int currentRank = 6 + rnd.nextInt(20);
                List<Tier> tiers = new ArrayList<>();
                int delta = 0;
                for (int n = 1; n <= 3; n++) {
                    delta += 5 + rnd.nextInt(200);
                    tiers.add(Fixtures.tier(currentRank - n, n, delta, total));
                }
                groups.add(new PlanningContext.PlanGroup(Fixtures.variant("t" + g), "t" + g, currentRank, 10_000, tiers));
                maxGain += 3;
            }

            for (int floor = 1; floor <= maxGain; floor++) {
                List<OvertakePlanItem> picked = planner.solve(groups, maxGain, floor);

                assertThat(picked).extracting(i -> i.getVariant().trackSlug()).doesNotHaveDuplicates();
                assertThat(picked.stream().mapToInt(OvertakePlanItem::getPositionsGained).sum()).isGreaterThanOrEqualTo(floor);
                double dpCost = picked.stream().mapToDouble(i -> difficulty.weightedCost(tierOf(i), i.getCurrentRank())).sum();
                assertThat(dpCost).isCloseTo(bruteForce(groups, floor), within(1e-6));
            }
        }
    }

    private static Tier tierOf(OvertakePlanItem item) {
        return new Tier(item.getNewRank(), item.getOpponentTimeCs(), item.getTargetTimeCs(), item.getPositionsGained(),
                item.getAfImprovement(), item.getTimeDeltaCs(), item.getEfficiency());
    }

    // every group: skip or one of its options
    private double bruteForce(List<PlanningContext.PlanGroup> groups, int floor) {
        int combos = 1;
        for (PlanningContext.PlanGroup g : groups) combos *= g.options().size() + 1;
        double best = Double.POSITIVE_INFINITY;
        for (int code = 0; code < combos; code++) {
            int rest = code;
            int gain = 0;
            double cost = 0;
            for (PlanningContext.PlanGroup g : groups) {
                int pick = rest % (g.options().size() + 1);
                rest /= g.options().size() + 1;
                if (pick == 0) continue;
                Tier t = g.options().get(pick - 1);
                gain += t.getPositionsGained();
                cost += difficulty.weightedCost(t, g.currentRank());
            }
            if (gain >= floor && cost < best) best = cost;
        }
        return best;
    }
}
