package com.astroshift.model;

import java.util.Locale;

public class RasterStatistics {
    public final int validPixels;
    public final int totalPixels;
    public final double coverage; // fracción 0..1

    // Solo sobre píxeles válidos
    public final double mean;
    public final double stdDev;
    public final double min;
    public final double max;

    public RasterStatistics(int validPixels, int totalPixels, double mean, double stdDev, double min, double max) {
        this.validPixels = validPixels;
        this.totalPixels = totalPixels;
        this.coverage = totalPixels > 0 ? (double) validPixels / totalPixels : 0;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "valid=%d/%d (%.1f%%), mean=%.3f, stdDev=%.3f, min=%.3f, max=%.3f",
                             validPixels, totalPixels, coverage * 100.0, mean, stdDev, min, max);
    }
}
