package com.dkr.optimizer.service;

import com.dkr.optimizer.config.OptimizerSettings;
import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.Opportunity;
import com.dkr.optimizer.model.PlayerStanding;
import com.dkr.optimizer.model.StandingsSnapshot;
import com.dkr.optimizer.model.Tier;
import com.dkr.optimizer.model.TrackVariant;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityServiceTest {

    private final OpportunityService service =
            new OpportunityService(new TierDerivationService(), OptimizerSettings.defaults());

    private static List<LeaderboardEntry> withPlayer(List<LeaderboardEntry> ahead, int rank, int timeCs) {
        List<LeaderboardEntry> out = new ArrayList<>(ahead);
        out.add(LeaderboardEntry.real(rank, "Me", timeCs));
        return out;
    }

    @Test
    void rankedVariantLocatesPlayerCaseInsensitively() {
        TrackVariant v = Fixtures.variant("ancient-lake");
        List<LeaderboardEntry> board = withPlayer(Fixtures.board(9000, 9200, 9400, 9600), 5, 10000);
        PlayerStanding standing = new PlayerStanding(v, "Ancient Lake", 5, 10000, false);

        Opportunity opp = service.rankedOpportunity(standing, board, 40, "me");

        assertThat(opp.getCurrentRank()).isEqualTo(5);
        assertThat(opp.getTiers()).extracting(Tier::getPositionsGained).containsExactly(1, 3, 4);
        Tier first = opp.getTiers().get(0);
        assertThat(first.getTargetRank()).isEqualTo(4);
        assertThat(first.getTargetTimeCs()).isEqualTo(9599);
        assertThat(first.getTimeDeltaCs()).isEqualTo(401);
        assertThat(opp.getBestTier()).isSameAs(opp.getTiers().get(opp.getBestTierIndex()));
        for (Tier t : opp.getTiers()) {
            assertThat(opp.getBestEfficiency().compareTo(t.getEfficiency())).isGreaterThanOrEqualTo(0);
        }
    }

    @Test
    void missingOwnRowFallsBackToStandingAndStrictlyFasterEntries() {
        TrackVariant v = Fixtures.variant("fossil-canyon");
        List<LeaderboardEntry> board = Fixtures.board(9000, 9200, 9500, 9500, 9800);
        PlayerStanding standing = new PlayerStanding(v, "Fossil Canyon", 3, 9500, false);

        OpportunityService.PlayerPosition pos = service.locate(standing, board, "ghost");

        assertThat(pos.rank()).isEqualTo(3);
        assertThat(pos.timeCs()).isEqualTo(9500);
        assertThat(pos.above()).extracting(LeaderboardEntry::getTimeCs).containsExactly(9000, 9200);
    }

    @Test
    void firstPlaceHasNoTiers() {
        TrackVariant v = Fixtures.variant("jungle-falls");
        List<LeaderboardEntry> board = withPlayer(List.of(), 1, 5000);
        board.add(LeaderboardEntry.real(2, "other", 5100));

        Opportunity opp = service.rankedOpportunity(new PlayerStanding(v, "Jungle Falls", 1, 5000, false), board, 10, "Me");

        assertThat(opp.hasTiers()).isFalse();
        assertThat(opp.getBestTier()).isNull();
        assertThat(opp.getBestEfficiency().isInfinite()).isFalse();
    }

    @Test
    void naVariantGetsSingleFreeInfiniteTier() {
        TrackVariant v = Fixtures.variant("crescent-island");
        List<LeaderboardEntry> real = Fixtures.board(9000, 9200, 9400);

        Opportunity opp = service.naOpportunity(PlayerStanding.na(v, "Crescent Island"), real, 10);

        assertThat(opp.isNa()).isTrue();
        assertThat(opp.getCurrentRank()).isEqualTo(4);
        assertThat(opp.getTiers()).hasSize(1);
        Tier t = opp.getTiers().get(0);
        assertThat(t.getTargetRank()).isEqualTo(4);
        assertThat(t.getTimeDeltaCs()).isZero();
        assertThat(t.getOpponentTimeCs()).isEqualTo(9400);
        assertThat(t.getEfficiency().isInfinite()).isTrue();
        assertThat(opp.getBestEfficiency().isInfinite()).isTrue();
    }

    @Test
    void naVariantWithoutRealEntriesHasNothingToAnalyze() {
        TrackVariant v = Fixtures.variant("pirate-lagoon");
        List<LeaderboardEntry> real = List.of();

        Opportunity opp = service.naOpportunity(PlayerStanding.na(v, "Pirate Lagoon"), real, 10);

        assertThat(opp.isNa()).isTrue();
        assertThat(opp.hasTiers()).isFalse();
    }

    @Test
    void opportunitiesSortByEfficiencyWithNaFirstAndSkipOutOfScopeVariants() {
        TrackVariant cheap = Fixtures.variant("cheap");
        TrackVariant dear = Fixtures.variant("dear");
        TrackVariant na = Fixtures.variant("na");
        TrackVariant noBoard = Fixtures.variant("no-board");

        Map<TrackVariant, List<LeaderboardEntry>> boards = new LinkedHashMap<>();
        boards.put(dear, withPlayer(Fixtures.board(8000), 2, 9000));   // 1001cs for one place
        boards.put(cheap, withPlayer(Fixtures.board(8990), 2, 9000));  // 11cs for one place
        List<LeaderboardEntry> naBoard = new ArrayList<>(Fixtures.board(7000, 7100));
        naBoard.add(new LeaderboardEntry(3, "default", "Default", 99999, true));
        boards.put(na, naBoard);

        StandingsSnapshot snapshot = new StandingsSnapshot("Me", List.of(
                new PlayerStanding(dear, "Dear", 2, 9000, false),
                new PlayerStanding(cheap, "Cheap", 2, 9000, false),
                PlayerStanding.na(na, "Na"),
                new PlayerStanding(noBoard, "Nowhere", 3, 9000, false)
        ), boards);

        List<Opportunity> opps = service.computeOpportunities(snapshot);

        assertThat(opps).extracting(o -> o.getVariant().trackSlug()).containsExactly("na", "cheap", "dear");
        // placeholder rows never count as competitors
        assertThat(opps.get(0).getCurrentRank()).isEqualTo(3);
        assertThat(snapshot.getTotalTracks()).isEqualTo(3);
    }

    @Test
    void planningContextUsesEveryClimbAndHonoursExclusions() {
        TrackVariant ranked = Fixtures.variant("ranked");
        TrackVariant excluded = new TrackVariant("excluded", "hover", "standard", "1-lap");
        TrackVariant na = Fixtures.variant("na");

        Map<TrackVariant, List<LeaderboardEntry>> boards = new LinkedHashMap<>();
        boards.put(ranked, withPlayer(Fixtures.board(8000, 8200, 8400, 8600, 8800, 9000), 7, 9500));
        boards.put(excluded, withPlayer(Fixtures.board(8000), 2, 9000));
        boards.put(na, Fixtures.board(7000, 7100));

        StandingsSnapshot snapshot = new StandingsSnapshot("me", List.of(
                new PlayerStanding(ranked, "Ranked", 7, 9500, false),
                new PlayerStanding(excluded, "Excluded", 2, 9000, false),
                PlayerStanding.na(na, "Na")
        ), boards);

        PlanningContext ctx = service.buildPlanningContext(snapshot, v -> v.matches("excluded", "HOVER"));

        assertThat(ctx.getGroups()).hasSize(1);
        assertThat(ctx.getGroups().get(0).options()).extracting(Tier::getPositionsGained)
                .containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(ctx.getGroups().get(0).maxGain()).isEqualTo(6);
        assertThat(ctx.getNaItems()).hasSize(1);
        assertThat(ctx.getNaItems().get(0).isNa()).isTrue();
        assertThat(ctx.getTotalTracks()).isEqualTo(3);
    }
}
