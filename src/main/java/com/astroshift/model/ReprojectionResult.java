package com.astroshift.model;

import java.io.File;

public class ReprojectionResult {
    public final Raster raster;
    public final ValidityMask mask;
    public final RasterStatistics statistics;
    public final File outputFile; // null si no se guardó

    public ReprojectionResult(Raster raster, ValidityMask mask, RasterStatistics statistics, File outputFile) {
        this.raster = raster;
        this.mask = mask;
        this.statistics = statistics;
        this.outputFile = outputFile;
    }
}
