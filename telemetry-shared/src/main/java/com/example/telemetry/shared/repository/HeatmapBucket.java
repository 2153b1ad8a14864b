package com.example.telemetry.shared.repository;

public record HeatmapBucket(double lat, double lng, long weight) {
}
