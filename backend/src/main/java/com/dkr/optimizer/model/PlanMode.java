package com.dkr.optimizer.model;

public enum PlanMode {
    /** Least total (difficulty weighted) time to shave. */
    MIN_TIME,
    /** Fewest tracks to practice. */
    MIN_TRACKS
}
