package com.dkr.optimizer.service;

import com.dkr.optimizer.model.Efficiency;
import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.OvertakePlanItem;
import com.dkr.optimizer.model.Tier;
import com.dkr.optimizer.model.TrackVariant;

import java.util.ArrayList;
import java.util.List;

final class Fixtures {

    private Fixtures() {}

    static TrackVariant variant(String slug) {
        return new TrackVariant(slug, "car", "standard", "3-laps");
    }

    /** Real entries ranked 1..n with the given times. */
    static List<LeaderboardEntry> board(int... times) {
        List<LeaderboardEntry> out = new ArrayList<>();
        for (int i = 0; i < times.length; i++) {
            out.add(LeaderboardEntry.real(i + 1, "racer" + (i + 1), times[i]));
        }
        return out;
    }

    static Tier tier(int targetRank, int positions, int deltaCs, int totalTracks) {
        double af = (double) positions / totalTracks;
        return new Tier(targetRank, 1000, 999, positions, af, deltaCs, Efficiency.of(af / deltaCs));
    }

    static OvertakePlanItem naItem(String slug, int positions, int totalTracks) {
        Tier t = new Tier(10, 5000, 5000, positions, (double) positions / totalTracks, 0, Efficiency.INFINITE);
        return new OvertakePlanItem(variant(slug), slug, true, 10 + positions, 0, t);
    }

    static PlanningContext.PlanGroup group(String slug, int currentRank, Tier... tiers) {
        return new PlanningContext.PlanGroup(variant(slug), slug, currentRank, 10_000, List.of(tiers));
    }
}
