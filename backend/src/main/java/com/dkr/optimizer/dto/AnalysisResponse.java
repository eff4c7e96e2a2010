package com.dkr.optimizer.dto;

import com.dkr.optimizer.model.Opportunity;
import com.dkr.optimizer.model.OvertakePlan;
import com.dkr.optimizer.service.TimeOverrideService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnalysisResponse {
    private AnalysisSummary summary;
    private List<Opportunity> opportunities = new ArrayList<>();
    private OvertakePlan overtakeMinTime;   // null when there is no rival
    private OvertakePlan overtakeMinTracks;
    private List<TimeOverrideService.AppliedOverride> appliedOverrides = new ArrayList<>();
    private Map<String, String> leaderboardUrls = new LinkedHashMap<>(); // variant key -> page

    public AnalysisSummary getSummary() { return summary; }
    public void setSummary(AnalysisSummary summary) { this.summary = summary; }
    public List<Opportunity> getOpportunities() { return opportunities; }
    public void setOpportunities(List<Opportunity> opportunities) { this.opportunities = opportunities; }
    public OvertakePlan getOvertakeMinTime() { return overtakeMinTime; }
    public void setOvertakeMinTime(OvertakePlan overtakeMinTime) { this.overtakeMinTime = overtakeMinTime; }
    public OvertakePlan getOvertakeMinTracks() { return overtakeMinTracks; }
    public void setOvertakeMinTracks(OvertakePlan overtakeMinTracks) { this.overtakeMinTracks = overtakeMinTracks; }
    public List<TimeOverrideService.AppliedOverride> getAppliedOverrides() { return appliedOverrides; }
    public void setAppliedOverrides(List<TimeOverrideService.AppliedOverride> appliedOverrides) { this.appliedOverrides = appliedOverrides; }
    public Map<String, String> getLeaderboardUrls() { return leaderboardUrls; }
    public void setLeaderboardUrls(Map<String, String> leaderboardUrls) { this.leaderboardUrls = leaderboardUrls; }
}
