package com.dkr.optimizer.service;

import com.dkr.optimizer.config.OptimizerSettings;
import com.dkr.optimizer.model.Efficiency;
import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.Opportunity;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.PlayerStanding;
import com.dkr.optimizer.model.StandingsSnapshot;
import com.dkr.optimizer.model.Tier;
import com.dkr.optimizer.model.TrackVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Builds the per-variant opportunities and the planning option sets from a standings snapshot.
 */
@Service
public class OpportunityService {

    private static final Logger log = LoggerFactory.getLogger(OpportunityService.class);

    /** Best efficiency first; infinite (N/A) before everything finite. */
    public static final Comparator<Opportunity> BY_EFFICIENCY_DESC =
            Comparator.comparing(Opportunity::getBestEfficiency).reversed();

    private final TierDerivationService tierDerivationService;
    private final OptimizerSettings settings;

    public OpportunityService(TierDerivationService tierDerivationService, OptimizerSettings settings) {
        this.tierDerivationService = tierDerivationService;
        this.settings = settings;
    }

    /** Where the player sits on a ranked variant and who is ahead, furthest first. */
    public record PlayerPosition(int rank, int timeCs, List<LeaderboardEntry> above) {}

    public List<Opportunity> computeOpportunities(StandingsSnapshot snapshot) {
        int totalTracks = snapshot.getTotalTracks();
        List<Opportunity> out = new ArrayList<>();
        for (PlayerStanding standing : snapshot.getStandings()) {
            TrackVariant variant = standing.getVariant();
            if (!snapshot.hasLeaderboard(variant)) continue; // out of scope
            List<LeaderboardEntry> real = snapshot.realEntries(variant);
            Opportunity opp = standing.isNa()
                    ? naOpportunity(standing, real, totalTracks)
                    : rankedOpportunity(standing, real, totalTracks, snapshot.getUsername());
            out.add(opp);
        }
        out.sort(BY_EFFICIENCY_DESC);
        log.debug("[Opportunities] username={} variants={} withTiers={}", snapshot.getUsername(), out.size(),
                out.stream().filter(Opportunity::hasTiers).count());
        return out;
    }

    /**
     * No time submitted: the player is last, one past the worst real rank, and any submitted time lands
     * just below the worst real entry. The single tier is free and infinitely efficient.
     */
    public Opportunity naOpportunity(PlayerStanding standing, List<LeaderboardEntry> real, int totalTracks) {
        if (real.isEmpty()) {
            return Opportunity.empty(standing.getVariant(), standing.getTrackName(), 0, 0, true);
        }
        LeaderboardEntry worst = real.get(real.size() - 1);
        int lastPlaceRank = naLastPlaceRank(real);
        int estimatedRank = worst.getRank() + 1;
        int positionsGained = lastPlaceRank - estimatedRank;
        Tier tier = new Tier(
                estimatedRank,
                worst.getTimeCs(),
                worst.getTimeCs(),
                positionsGained,
                (double) positionsGained / totalTracks,
                0,
                Efficiency.INFINITE
        );
        return new Opportunity(standing.getVariant(), standing.getTrackName(), lastPlaceRank, 0, true,
                List.of(tier), Efficiency.INFINITE, 0);
    }

    /** Effective rank of a player without a time: one past the worst real entry. */
    public static int naLastPlaceRank(List<LeaderboardEntry> real) {
        return real.isEmpty() ? 1 : real.get(real.size() - 1).getRank() + 1;
    }

    public Opportunity rankedOpportunity(PlayerStanding standing, List<LeaderboardEntry> real,
                                         int totalTracks, String username) {
        PlayerPosition pos = locate(standing, real, username);
        if (pos.above().isEmpty() || pos.rank() <= 1) {
            return Opportunity.empty(standing.getVariant(), standing.getTrackName(), pos.rank(), pos.timeCs(), false);
        }
        List<Tier> tiers = tierDerivationService.derive(pos.rank(), pos.timeCs(), pos.above(), totalTracks,
                settings.getTierTargets());

        Efficiency best = Efficiency.ZERO;
        int bestIdx = 0;
        for (int i = 0; i < tiers.size(); i++) {
            Efficiency e = tiers.get(i).getEfficiency();
            if (e.isGreaterThan(best)) {
                best = e;
                bestIdx = i;
            }
        }
        return new Opportunity(standing.getVariant(), standing.getTrackName(), pos.rank(), pos.timeCs(), false,
                tiers, best, bestIdx);
    }

    /**
     * Finds the player's own row by case-insensitive username. Without one, the standing's rank/time
     * are used and everyone strictly faster counts as ahead.
     */
    public PlayerPosition locate(PlayerStanding standing, List<LeaderboardEntry> real, String username) {
        for (int idx = 0; idx < real.size(); idx++) {
            LeaderboardEntry e = real.get(idx);
            if (e.isUser(username)) {
                return new PlayerPosition(e.getRank(), e.getTimeCs(), List.copyOf(real.subList(0, idx)));
            }
        }
        int timeCs = standing.getTimeCs();
        List<LeaderboardEntry> above = real.stream().filter(e -> e.getTimeCs() < timeCs).toList();
        return new PlayerPosition(standing.getRank(), timeCs, above);
    }

    /**
     * Option sets for overtake planning: N/A variants become fixed items, ranked variants become groups
     * holding every reachable climb. Variants matching {@code excluded} are left out entirely.
     */
    public PlanningContext buildPlanningContext(StandingsSnapshot snapshot, Predicate<TrackVariant> excluded) {
        int totalTracks = snapshot.getTotalTracks();
        List<OvertakePlanItem> naItems = new ArrayList<>();
        List<PlanningContext.PlanGroup> groups = new ArrayList<>();

        for (PlayerStanding standing : snapshot.getStandings()) {
            TrackVariant variant = standing.getVariant();
            if (!snapshot.hasLeaderboard(variant) || excluded.test(variant)) continue;
            List<LeaderboardEntry> real = snapshot.realEntries(variant);

            if (standing.isNa()) {
                Opportunity na = naOpportunity(standing, real, totalTracks);
                if (na.hasTiers()) {
                    naItems.add(new OvertakePlanItem(variant, standing.getTrackName(), true,
                            na.getCurrentRank(), 0, na.getTiers().get(0)));
                }
                continue;
            }

            PlayerPosition pos = locate(standing, real, snapshot.getUsername());
            if (pos.above().isEmpty() || pos.rank() <= 1) continue;
            List<Tier> options = tierDerivationService.derive(pos.rank(), pos.timeCs(), pos.above(), totalTracks,
                    TierDerivationService.fullRange(pos.above().size()));
            if (options.isEmpty()) continue;
            groups.add(new PlanningContext.PlanGroup(variant, standing.getTrackName(), pos.rank(), pos.timeCs(), options));
        }
        log.debug("[Planning] naItems={} groups={} totalTracks={}", naItems.size(), groups.size(), totalTracks);
        return new PlanningContext(totalTracks, settings.getRequirementEpsilon(), naItems, groups);
    }
}
