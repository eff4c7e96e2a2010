package com.dkr.optimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
public class OptimizerSettings {

    public static final int[] DEFAULT_TIER_TARGETS = {1, 3, 5, 10, 15, 20, 25};
    public static final double DEFAULT_DIFFICULTY_K = 5.0;
    public static final double DEFAULT_REQUIREMENT_EPSILON = 1e-9;

    // Climb sizes shown per variant in the opportunity list
    @Value("${optimizer.tiers.targets:1,3,5,10,15,20,25}")
    private int[] tierTargets = DEFAULT_TIER_TARGETS;

    @Value("${optimizer.difficulty.k:5.0}")
    private double difficultyK = DEFAULT_DIFFICULTY_K;

    @Value("${optimizer.requirement.epsilon:1e-9}")
    private double requirementEpsilon = DEFAULT_REQUIREMENT_EPSILON;

    @Value("${optimizer.leaderboard.base-url:https://www.dkr64.com}")
    private String leaderboardBaseUrl = "https://www.dkr64.com";

    public OptimizerSettings() {}

    // Manual wiring for tests
    public OptimizerSettings(int[] tierTargets, double difficultyK, double requirementEpsilon) {
        this.tierTargets = tierTargets.clone();
        this.difficultyK = difficultyK;
        this.requirementEpsilon = requirementEpsilon;
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(DEFAULT_TIER_TARGETS, DEFAULT_DIFFICULTY_K, DEFAULT_REQUIREMENT_EPSILON);
    }

    public int[] getTierTargets() { return tierTargets.clone(); }
    public double getDifficultyK() { return difficultyK; }
    public double getRequirementEpsilon() { return requirementEpsilon; }
    public String getLeaderboardBaseUrl() { return leaderboardBaseUrl; }

    public String leaderboardUrl(String variantKey) {
        String base = leaderboardBaseUrl.endsWith("/") ? leaderboardBaseUrl.substring(0, leaderboardBaseUrl.length() - 1) : leaderboardBaseUrl;
        return base + "/tracks/" + variantKey;
    }

    @Override
    public String toString() {
        return "OptimizerSettings{tierTargets=" + Arrays.toString(tierTargets) + ", k=" + difficultyK + ", eps=" + requirementEpsilon + "}";
    }
}
