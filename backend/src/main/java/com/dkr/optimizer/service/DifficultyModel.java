package com.dkr.optimizer.service;

import com.dkr.optimizer.config.OptimizerSettings;
import com.dkr.optimizer.model.Tier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Exponential cost multiplier {@code exp(K * (1 - target/current))}: 1 for no climb, growing
 * towards {@code exp(K)} as the target approaches rank 1. Gains are never reweighted.
 */
@Component
public class DifficultyModel {

    private final double k;

    @Autowired
    public DifficultyModel(OptimizerSettings settings) {
        this(settings.getDifficultyK());
    }

    public DifficultyModel(double k) {
        this.k = k;
    }

    public double weight(int targetRank, int currentRank) {
        if (currentRank <= 0 || targetRank <= 0) return 1.0;
        return Math.exp(k * (1.0 - (double) targetRank / currentRank));
    }

    public double weightedCost(Tier tier, int currentRank) {
        return tier.getTimeDeltaCs() * weight(tier.getTargetRank(), currentRank);
    }

    public double getK() { return k; }
}
