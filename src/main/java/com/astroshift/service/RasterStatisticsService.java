package com.astroshift.service;

import com.astroshift.model.Raster;
import com.astroshift.model.RasterStatistics;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

public class RasterStatisticsService {

    public RasterStatistics analyze(Raster raster, double missingValue) {
        int w = raster.width(), h = raster.height();
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();

        int valid = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double val = raster.get(y, x);
                // ImageJ ignora los NaN en imágenes float
                if (isMissing(val, missingValue)) {
                    px[y * w + x] = Float.NaN;
                } else {
                    px[y * w + x] = (float) val;
                    valid++;
                }
            }
        }

        if (valid == 0) {
            return new RasterStatistics(0, w * h, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        ImageStatistics stats = ip.getStatistics();
        return new RasterStatistics(valid, w * h, stats.mean, stats.stdDev, stats.min, stats.max);
    }

    static boolean isMissing(double val, double missingValue) {
        // ImageJ tampoco cuenta los infinitos en media, mínimo y máximo
        if (Double.isNaN(val) || Double.isInfinite(val)) return true;
        return val == missingValue;
    }
}
