package com.example.telemetry.shared.geo;

public enum TrackResult {
    TRACKED,
    /** The address could not be placed; nothing is persisted for Unknown locations. */
    SKIPPED_UNKNOWN,
    FAILED
}
