package com.dkr.optimizer.model;

import java.util.Objects;

/**
 * One scored leaderboard: track, vehicle class, category and lap count.
 */
public record TrackVariant(String trackSlug, String vehicle, String category, String laps) {

    public TrackVariant {
        Objects.requireNonNull(trackSlug, "trackSlug");
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(laps, "laps");
    }

    /** {@code track/vehicle/category/laps}, also the leaderboard path below {@code /tracks/}. */
    public String key() {
        return trackSlug + "/" + vehicle + "/" + category + "/" + laps;
    }

    public boolean matches(String track, String vehicleClass) {
        return trackSlug.equalsIgnoreCase(track) && vehicle.equalsIgnoreCase(vehicleClass);
    }

    @Override
    public String toString() { return key(); }
}
