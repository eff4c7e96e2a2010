package com.dkr.optimizer.service;

import com.dkr.optimizer.config.OptimizerSettings;
import com.dkr.optimizer.dto.AnalysisRequest;
import com.dkr.optimizer.dto.AnalysisResponse;
import com.dkr.optimizer.dto.AnalysisSummary;
import com.dkr.optimizer.model.LeaderboardEntry;
import com.dkr.optimizer.model.Opportunity;
import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.model.PlayerStanding;
import com.dkr.optimizer.model.StandingsSnapshot;
import com.dkr.optimizer.model.TimeOverride;
import com.dkr.optimizer.model.TrackVariant;
import com.dkr.optimizer.util.TimeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Runs one optimizer pass: overrides, opportunities, rival resolution and both overtake plans.
 */
@Service
public class OptimizerOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OptimizerOrchestratorService.class);

    private final OpportunityService opportunityService;
    private final OvertakePlannerService overtakePlannerService;
    private final MinTracksPlannerService minTracksPlannerService;
    private final TimeOverrideService timeOverrideService;
    private final OptimizerSettings settings;

    public OptimizerOrchestratorService(OpportunityService opportunityService,
                                        OvertakePlannerService overtakePlannerService,
                                        MinTracksPlannerService minTracksPlannerService,
                                        TimeOverrideService timeOverrideService,
                                        OptimizerSettings settings) {
        this.opportunityService = opportunityService;
        this.overtakePlannerService = overtakePlannerService;
        this.minTracksPlannerService = minTracksPlannerService;
        this.timeOverrideService = timeOverrideService;
        this.settings = settings;
    }

    /** The rival to pass: who and at which AF. */
    public record Rival(String username, double af) {}

    public AnalysisResponse analyze(AnalysisRequest req) {
        StandingsSnapshot snapshot = toSnapshot(req);
        Optional<AnalysisRequest.RankingRow> own = findRow(req, req.getUsername());
        Double baseAf = req.getCurrentAf() != null ? req.getCurrentAf() : own.map(AnalysisRequest.RankingRow::getAf).orElse(null);
        Integer currentRank = req.getCurrentRank() != null ? req.getCurrentRank() : own.map(AnalysisRequest.RankingRow::getRank).orElse(null);

        TimeOverrideService.Result overridden = timeOverrideService.apply(snapshot, toOverrides(req));
        snapshot = overridden.snapshot();
        Double currentAf = baseAf == null ? null : baseAf + overridden.afDelta();
        if (!overridden.applied().isEmpty()) {
            log.info("[Optimizer][Overrides] applied={} AF {} -> {}", overridden.applied().size(), baseAf, currentAf);
        }

        AnalysisResponse resp = new AnalysisResponse();
        resp.setAppliedOverrides(overridden.applied());
        List<Opportunity> opportunities = opportunityService.computeOpportunities(snapshot);
        resp.setOpportunities(opportunities);
        for (TrackVariant v : snapshot.getLeaderboards().keySet()) {
            resp.getLeaderboardUrls().put(v.key(), settings.leaderboardUrl(v.key()));
        }
        resp.setSummary(summarize(snapshot, opportunities, currentAf, currentRank));

        Optional<Rival> rival = resolveRival(req, currentRank);
        if (rival.isPresent() && currentAf != null && snapshot.getTotalTracks() > 0) {
            Rival r = rival.get();
            PlanningContext ctx = opportunityService.buildPlanningContext(snapshot, exclusions(req));
            OvertakePlan minTime = overtakePlannerService.plan(ctx, currentAf, r.af(), r.username());
            OvertakePlan minTracks = minTracksPlannerService.plan(ctx, currentAf, r.af(), r.username());
            resp.setOvertakeMinTime(minTime);
            resp.setOvertakeMinTracks(minTracks);
            if (minTime.isFeasible()) {
                log.info("[Optimizer][Overtake] rival={} minTime: {} tracks, {}; minTracks: {} tracks, {}", r.username(),
                        minTime.getItems().size(), TimeCodec.format(minTime.getTimeInvestmentCs()),
                        minTracks.getItems().size(), TimeCodec.format(minTracks.getTimeInvestmentCs()));
            } else {
                log.info("[Optimizer][Overtake] rival={} not reachable: need {} positions, best {}", r.username(),
                        minTime.getPositionsNeeded(), minTime.getPositionsGained());
            }
        } else {
            log.info("[Optimizer][Overtake] no rival to plan against (rank={}, af={})", currentRank, currentAf);
        }
        return resp;
    }

    public List<Opportunity> opportunities(AnalysisRequest req) {
        StandingsSnapshot snapshot = timeOverrideService.apply(toSnapshot(req), toOverrides(req)).snapshot();
        return opportunityService.computeOpportunities(snapshot);
    }

    /**
     * An explicit rival wins; otherwise the combined ranking row one place above the player.
     */
    Optional<Rival> resolveRival(AnalysisRequest req, Integer currentRank) {
        if (req.getRivalUsername() != null && !req.getRivalUsername().isBlank()) {
            Double af = req.getRivalAf() != null ? req.getRivalAf()
                    : findRow(req, req.getRivalUsername()).map(AnalysisRequest.RankingRow::getAf).orElse(null);
            if (af == null) {
                throw new IllegalArgumentException("No AF known for rival '" + req.getRivalUsername() + "'");
            }
            return Optional.of(new Rival(req.getRivalUsername(), af));
        }
        if (currentRank == null || currentRank <= 1) return Optional.empty();
        return safe(req.getCombinedRanking()).stream()
                .filter(r -> r.getRank() == currentRank - 1)
                .findFirst()
                .map(r -> new Rival(r.getUsername(), r.getAf()));
    }

    StandingsSnapshot toSnapshot(AnalysisRequest req) {
        if (req == null || req.getUsername() == null || req.getUsername().isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        List<PlayerStanding> standings = new ArrayList<>();
        for (AnalysisRequest.Standing s : safe(req.getStandings())) {
            TrackVariant variant = variantOf(s);
            Integer timeCs = timeOf(s.getTimeCs(), s.getTime());
            if (s.isNa() || timeCs == null || timeCs <= 0) {
                standings.add(PlayerStanding.na(variant, s.getTrackName()));
            } else {
                standings.add(new PlayerStanding(variant, s.getTrackName(), s.getRank(), timeCs, false));
            }
        }
        Map<TrackVariant, List<LeaderboardEntry>> boards = new LinkedHashMap<>();
        for (AnalysisRequest.Leaderboard lb : safe(req.getLeaderboards())) {
            List<LeaderboardEntry> entries = new ArrayList<>();
            for (AnalysisRequest.Entry e : safe(lb.getEntries())) {
                Integer timeCs = timeOf(e.getTimeCs(), e.getTime());
                if (timeCs == null) {
                    throw new IllegalArgumentException("Leaderboard entry without time: " + e.getUsername() + " on " + variantOf(lb).key());
                }
                entries.add(new LeaderboardEntry(e.getRank(), e.getUsername(), e.getDisplayName(), timeCs, e.isPlaceholder()));
            }
            boards.put(variantOf(lb), entries);
        }
        return new StandingsSnapshot(req.getUsername(), standings, boards);
    }

    AnalysisSummary summarize(StandingsSnapshot snapshot, List<Opportunity> opportunities, Double currentAf, Integer currentRank) {
        AnalysisSummary s = new AnalysisSummary();
        s.setUsername(snapshot.getUsername());
        s.setCombinedRank(currentRank);
        s.setCurrentAf(currentAf == null ? 0.0 : currentAf);
        s.setTotalTracksInScope(snapshot.getTotalTracks());
        int na = 0, improvable = 0, first = 0;
        for (Opportunity o : opportunities) {
            if (o.isNa()) na++;
            else if (o.hasTiers()) improvable++;
            else first++;
        }
        s.setTracksNa(na);
        s.setTracksWithImprovementPossible(improvable);
        s.setTracksAtFirstPlace(first);
        s.setTracksWithTimes(improvable + first);
        return s;
    }

    private Predicate<TrackVariant> exclusions(AnalysisRequest req) {
        List<AnalysisRequest.Exclusion> ex = safe(req.getExcludeFromPlans());
        if (!ex.isEmpty()) log.info("[Optimizer][Overtake] excluding {} track/vehicle combos from plans", ex.size());
        return v -> ex.stream().anyMatch(e -> v.matches(e.getTrack(), e.getVehicle()));
    }

    private static List<TimeOverride> toOverrides(AnalysisRequest req) {
        List<TimeOverride> out = new ArrayList<>();
        for (AnalysisRequest.OverrideRow o : safe(req.getTimeOverrides())) {
            out.add(new TimeOverride(o.getTrack(), o.getVehicle(), o.getCategory(), o.getLaps(), o.getTime()));
        }
        return out;
    }

    private static Optional<AnalysisRequest.RankingRow> findRow(AnalysisRequest req, String username) {
        return safe(req.getCombinedRanking()).stream()
                .filter(r -> r.getUsername() != null && r.getUsername().equalsIgnoreCase(username))
                .findFirst();
    }

    private static TrackVariant variantOf(AnalysisRequest.Variant v) {
        if (v.getTrack() == null || v.getVehicle() == null || v.getLaps() == null) {
            throw new IllegalArgumentException("track, vehicle and laps are required for every variant");
        }
        String category = v.getCategory() == null || v.getCategory().isBlank() ? "standard" : v.getCategory();
        return new TrackVariant(v.getTrack(), v.getVehicle(), category, v.getLaps());
    }

    private static Integer timeOf(Integer timeCs, String text) {
        if (timeCs != null) return timeCs;
        if (text == null || text.isBlank()) return null;
        return TimeCodec.parse(text);
    }

    private static <T> List<T> safe(List<T> list) { return list == null ? List.of() : list; }
}
