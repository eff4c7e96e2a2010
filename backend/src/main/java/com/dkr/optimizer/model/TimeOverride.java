package com.dkr.optimizer.model;

/**
 * A time the player has set but that is not on the leaderboard snapshot yet.
 */
public record TimeOverride(String track, String vehicle, String category, String laps, String time) {

    public TrackVariant variant() {
        String cat = (category == null || category.isBlank()) ? "standard" : category;
        return new TrackVariant(track, vehicle, cat, laps);
    }
}
