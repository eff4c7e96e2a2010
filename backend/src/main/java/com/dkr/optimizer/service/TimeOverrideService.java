package com.dkr.optimizer.service;

import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.PlayerStanding;
import com.dkr.optimizer.model.StandingsSnapshot;
import com.dkr.optimizer.model.TimeOverride;
import com.dkr.optimizer.model.TrackVariant;
import com.dkr.optimizer.util.TimeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies manual time overrides to a snapshot before analysis. Produces a new snapshot; the input is untouched.
 */
@Service
public class TimeOverrideService {

    private static final Logger log = LoggerFactory.getLogger(TimeOverrideService.class);

    public record AppliedOverride(String variantKey, int oldTimeCs, int newTimeCs, int oldRank, int newRank) {
        public String getOldTime() { return TimeCodec.formatOrNa(oldTimeCs); }
        public String getNewTime() { return TimeCodec.format(newTimeCs); }
    }

    public record Result(StandingsSnapshot snapshot, double afDelta, List<AppliedOverride> applied) {}

    public Result apply(StandingsSnapshot snapshot, List<TimeOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return new Result(snapshot, 0.0, List.of());
        }
        String username = snapshot.getUsername();
        List<PlayerStanding> standings = new ArrayList<>(snapshot.getStandings());
        Map<TrackVariant, List<LeaderboardEntry>> boards = new LinkedHashMap<>(snapshot.getLeaderboards());
        List<AppliedOverride> applied = new ArrayList<>();
        int rankDelta = 0;

        for (TimeOverride ovr : overrides) {
            TrackVariant variant = ovr.variant();
            int newTimeCs = TimeCodec.parse(ovr.time());

            int standingIdx = indexOfStanding(standings, variant);
            if (standingIdx < 0) {
                log.warn("[Overrides] {} has no matching player track, skipped", variant.key());
                continue;
            }
            List<LeaderboardEntry> entries = boards.get(variant);
            if (entries == null || entries.isEmpty()) {
                log.warn("[Overrides] no leaderboard for {}, skipped", variant.key());
                continue;
            }

            PlayerStanding standing = standings.get(standingIdx);
            List<LeaderboardEntry> working = new ArrayList<>(entries);
            int playerIdx = indexOfUser(working, username);
            int oldRank;
            if (playerIdx >= 0) {
                oldRank = working.get(playerIdx).getRank();
                working.set(playerIdx, working.get(playerIdx).withTime(newTimeCs));
            } else {
                oldRank = standing.isNa()
                        ? OpportunityService.naLastPlaceRank(working.stream().filter(e -> !e.isPlaceholder()).toList())
                        : standing.getRank();
                working.add(new LeaderboardEntry(0, username, username, newTimeCs, false));
            }

            List<LeaderboardEntry> reranked = rerank(working);
            int newRank = reranked.get(indexOfUser(reranked, username)).getRank();
            boards.put(variant, reranked);
            standings.set(standingIdx, standing.withResult(newRank, newTimeCs));

            rankDelta += newRank - oldRank;
            applied.add(new AppliedOverride(variant.key(), standing.getTimeCs(), newTimeCs, oldRank, newRank));
            log.info("[Overrides] {}: {} -> {}, rank {} -> {}", variant.key(),
                    TimeCodec.formatOrNa(standing.getTimeCs()), TimeCodec.format(newTimeCs), oldRank, newRank);
        }

        StandingsSnapshot updated = new StandingsSnapshot(username, standings, boards);
        double afDelta = applied.isEmpty() ? 0.0 : (double) rankDelta / updated.getTotalTracks();
        return new Result(updated, afDelta, applied);
    }

    /**
     * Real entries by time, placeholders after. Equal real times share a rank; placeholders take the
     * running rank without consuming it.
     */
    static List<LeaderboardEntry> rerank(List<LeaderboardEntry> entries) {
        List<LeaderboardEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(LeaderboardEntry::isPlaceholder).thenComparingInt(LeaderboardEntry::getTimeCs));

        List<LeaderboardEntry> out = new ArrayList<>(sorted.size());
        int rank = 1;
        for (LeaderboardEntry e : sorted) {
            if (e.isPlaceholder()) {
                out.add(e.withRank(rank));
                continue;
            }
            LeaderboardEntry prev = out.isEmpty() ? null : out.get(out.size() - 1);
            if (prev != null && !prev.isPlaceholder() && prev.getTimeCs() == e.getTimeCs()) {
                out.add(e.withRank(prev.getRank()));
            } else {
                out.add(e.withRank(rank));
            }
            rank++;
        }
        return out;
    }

    private static int indexOfStanding(List<PlayerStanding> standings, TrackVariant variant) {
        for (int i = 0; i < standings.size(); i++) {
            if (standings.get(i).getVariant().equals(variant)) return i;
        }
        return -1;
    }

    private static int indexOfUser(List<LeaderboardEntry> entries, String username) {
        for (int i = 0; i < entries.size(); i++) {
            if (!entries.get(i).isPlaceholder() && entries.get(i).isUser(username)) return i;
        }
        return -1;
    }
}
