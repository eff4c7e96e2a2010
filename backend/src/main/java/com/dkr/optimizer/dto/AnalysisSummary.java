package com.dkr.optimizer.dto;

public class AnalysisSummary {
    private String username;
    private Integer combinedRank;
    private double currentAf;
    private int totalTracksInScope;
    private int tracksWithTimes;
    private int tracksNa;
    private int tracksWithImprovementPossible;
    private int tracksAtFirstPlace; // ranked, nothing left to climb

    public AnalysisSummary() {}

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public Integer getCombinedRank() { return combinedRank; }
    public void setCombinedRank(Integer combinedRank) { this.combinedRank = combinedRank; }
    public double getCurrentAf() { return currentAf; }
    public void setCurrentAf(double currentAf) { this.currentAf = currentAf; }
    public int getTotalTracksInScope() { return totalTracksInScope; }
    public void setTotalTracksInScope(int totalTracksInScope) { this.totalTracksInScope = totalTracksInScope; }
    public int getTracksWithTimes() { return tracksWithTimes; }
    public void setTracksWithTimes(int tracksWithTimes) { this.tracksWithTimes = tracksWithTimes; }
    public int getTracksNa() { return tracksNa; }
    public void setTracksNa(int tracksNa) { this.tracksNa = tracksNa; }
    public int getTracksWithImprovementPossible() { return tracksWithImprovementPossible; }
    public void setTracksWithImprovementPossible(int tracksWithImprovementPossible) { this.tracksWithImprovementPossible = tracksWithImprovementPossible; }
    public int getTracksAtFirstPlace() { return tracksAtFirstPlace; }
    public void setTracksAtFirstPlace(int tracksAtFirstPlace) { this.tracksAtFirstPlace = tracksAtFirstPlace; }
}
