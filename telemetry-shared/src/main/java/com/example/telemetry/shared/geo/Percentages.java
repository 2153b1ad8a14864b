package com.example.telemetry.shared.geo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Percentages rounded to hundredths that add up to exactly 100 (largest remainder method).
 */
final class Percentages {

    private static final long TOTAL_UNITS = 10_000L;

    private Percentages() {}

    /**
     * Ties on the remainder go to the earlier position, so callers pass counts in ranking order.
     */
    static double[] of(long[] counts) {
        double[] percentages = new double[counts.length];
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        if (total == 0) {
            return percentages;
        }

        long[] units = new long[counts.length];
        long[] remainders = new long[counts.length];
        long assigned = 0;
        for (int i = 0; i < counts.length; i++) {
            units[i] = counts[i] * TOTAL_UNITS / total;
            remainders[i] = counts[i] * TOTAL_UNITS % total;
            assigned += units[i];
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingLong(i -> remainders[i]).reversed().thenComparingInt(i -> i));
        for (int i = 0; i < TOTAL_UNITS - assigned; i++) {
            units[order.get(i)]++;
        }

        for (int i = 0; i < counts.length; i++) {
            percentages[i] = units[i] / 100.0;
        }
        return percentages;
    }
}
