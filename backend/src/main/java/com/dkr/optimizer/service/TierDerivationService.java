package com.dkr.optimizer.service;

import com.dkr.optimizer.model.Efficiency;
import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Turns the competitors ahead of the player on one variant into reachable tiers.
 * Climbs are counted by list position, not rank number, so tied competitors are separate targets.
 */
@Service
public class TierDerivationService {

    private static final Logger log = LoggerFactory.getLogger(TierDerivationService.class);

    /**
     * @param currentRank  player's rank on the variant (used for diagnostics only)
     * @param currentTimeCs player's time
     * @param above        real entries ahead of the player, furthest ahead first
     * @param totalTracks  number of variants in scope
     * @param climbSizes   positions to attempt to jump; clamped to {@code above.size()}
     * @return tiers ordered by increasing positions gained
     */
    public List<Tier> derive(int currentRank, int currentTimeCs, List<LeaderboardEntry> above,
                             int totalTracks, int[] climbSizes) {
        List<Tier> tiers = new ArrayList<>();
        if (above == null || above.isEmpty() || climbSizes == null) return tiers;
        if (totalTracks <= 0) throw new IllegalArgumentException("totalTracks must be positive");

        // clamp and dedupe, smallest climb first
        TreeSet<Integer> sizes = new TreeSet<>();
        for (int requested : climbSizes) {
            int n = Math.min(requested, above.size());
            if (n <= 0) break;
            sizes.add(n);
        }

        for (int n : sizes) {
            LeaderboardEntry target = above.get(above.size() - n);
            int targetTimeCs = target.getTimeCs() - 1;
            int timeDelta = currentTimeCs - targetTimeCs;
            if (timeDelta <= 0) {
                log.debug("[Tiers][Skip] rank={} climb={} target={} already beaten ({}cs <= {}cs)",
                        currentRank, n, target.getUsername(), currentTimeCs, targetTimeCs);
                continue;
            }
            double afImprovement = (double) n / totalTracks;
            tiers.add(new Tier(
                    target.getRank(),
                    target.getTimeCs(),
                    targetTimeCs,
                    n,
                    afImprovement,
                    timeDelta,
                    Efficiency.of(afImprovement / timeDelta)
            ));
        }
        return tiers;
    }

    /** Every climb size from 1 to {@code n}, as used for planning. */
    public static int[] fullRange(int n) {
        return IntStream.rangeClosed(1, Math.max(0, n)).toArray();
    }
}
