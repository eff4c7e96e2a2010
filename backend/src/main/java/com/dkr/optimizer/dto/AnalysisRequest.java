package com.dkr.optimizer.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of everything the optimizer needs, as handed over by the data collector.
 */
public class AnalysisRequest {
    private String username;
    private Double currentAf;   // falls back to the player's combined ranking row
    private Integer currentRank;
    private String rivalUsername; // optional explicit rival
    private Double rivalAf;
    private List<Standing> standings = new ArrayList<>();
    private List<Leaderboard> leaderboards = new ArrayList<>();
    private List<RankingRow> combinedRanking = new ArrayList<>();
    private List<OverrideRow> timeOverrides = new ArrayList<>();
    private List<Exclusion> excludeFromPlans = new ArrayList<>();

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public Double getCurrentAf() { return currentAf; }
    public void setCurrentAf(Double currentAf) { this.currentAf = currentAf; }
    public Integer getCurrentRank() { return currentRank; }
    public void setCurrentRank(Integer currentRank) { this.currentRank = currentRank; }
    public String getRivalUsername() { return rivalUsername; }
    public void setRivalUsername(String rivalUsername) { this.rivalUsername = rivalUsername; }
    public Double getRivalAf() { return rivalAf; }
    public void setRivalAf(Double rivalAf) { this.rivalAf = rivalAf; }
    public List<Standing> getStandings() { return standings; }
    public void setStandings(List<Standing> standings) { this.standings = standings; }
    public List<Leaderboard> getLeaderboards() { return leaderboards; }
    public void setLeaderboards(List<Leaderboard> leaderboards) { this.leaderboards = leaderboards; }
    public List<RankingRow> getCombinedRanking() { return combinedRanking; }
    public void setCombinedRanking(List<RankingRow> combinedRanking) { this.combinedRanking = combinedRanking; }
    public List<OverrideRow> getTimeOverrides() { return timeOverrides; }
    public void setTimeOverrides(List<OverrideRow> timeOverrides) { this.timeOverrides = timeOverrides; }
    public List<Exclusion> getExcludeFromPlans() { return excludeFromPlans; }
    public void setExcludeFromPlans(List<Exclusion> excludeFromPlans) { this.excludeFromPlans = excludeFromPlans; }

    /** Identifies a variant; category defaults to "standard". */
    public static class Variant {
        private String track;
        private String vehicle;
        private String category = "standard";
        private String laps;
        public String getTrack() { return track; }
        public void setTrack(String track) { this.track = track; }
        public String getVehicle() { return vehicle; }
        public void setVehicle(String vehicle) { this.vehicle = vehicle; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public String getLaps() { return laps; }
        public void setLaps(String laps) { this.laps = laps; }
    }

    public static class Standing extends Variant {
        private String trackName;
        private int rank;        // 0 when N/A
        private String time;     // MM:SS:CC, absent when N/A
        private Integer timeCs;  // alternative to time
        private boolean na;
        public String getTrackName() { return trackName; }
        public void setTrackName(String trackName) { this.trackName = trackName; }
        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }
        public String getTime() { return time; }
        public void setTime(String time) { this.time = time; }
        public Integer getTimeCs() { return timeCs; }
        public void setTimeCs(Integer timeCs) { this.timeCs = timeCs; }
        public boolean isNa() { return na; }
        public void setNa(boolean na) { this.na = na; }
    }

    public static class Leaderboard extends Variant {
        private List<Entry> entries = new ArrayList<>();
        public List<Entry> getEntries() { return entries; }
        public void setEntries(List<Entry> entries) { this.entries = entries; }
    }

    public static class Entry {
        private int rank;
        private String username;
        private String displayName;
        private String time;
        private Integer timeCs;
        private boolean placeholder; // "Default Time" rows
        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getTime() { return time; }
        public void setTime(String time) { this.time = time; }
        public Integer getTimeCs() { return timeCs; }
        public void setTimeCs(Integer timeCs) { this.timeCs = timeCs; }
        public boolean isPlaceholder() { return placeholder; }
        public void setPlaceholder(boolean placeholder) { this.placeholder = placeholder; }
    }

    public static class RankingRow {
        private int rank;
        private String username;
        private double af;
        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public double getAf() { return af; }
        public void setAf(double af) { this.af = af; }
    }

    public static class OverrideRow extends Variant {
        private String time;
        public String getTime() { return time; }
        public void setTime(String time) { this.time = time; }
    }

    public static class Exclusion {
        private String track;
        private String vehicle;
        public String getTrack() { return track; }
        public void setTrack(String track) { this.track = track; }
        public String getVehicle() { return vehicle; }
        public void setVehicle(String vehicle) { this.vehicle = vehicle; }
    }
}
