package com.astroshift.service;

import com.astroshift.model.MappedCoordinateField;
import com.astroshift.model.MissingValuePolicy;
import com.astroshift.model.Raster;
import com.astroshift.model.RasterShape;
import com.astroshift.model.ValidityMask;

public class Resampler {

    private final MissingValuePolicy policy;
    private final double missingValue;

    public Resampler() {
        this(MissingValuePolicy.ZERO_AS_MISSING, Double.NaN);
    }

    public Resampler(MissingValuePolicy policy, double missingValue) {
        this.policy = policy;
        this.missingValue = missingValue;
    }

    public MissingValuePolicy getPolicy() { return policy; }

    public double getMissingValue() { return missingValue; }

    /**
     * A position is valid only if its mapped index lies inside both the output grid
     * and the target raster. NaN-derived indices fail every check.
     */
    public ValidityMask validityMask(RasterShape outputShape, Raster target, MappedCoordinateField mapped) {
        outputShape.requireSame("validity mask", mapped.shape);

        int outW = outputShape.width, outH = outputShape.height;
        int tgtW = target.width(), tgtH = target.height();

        boolean[][] valid = new boolean[outH][outW];
        for (int r = 0; r < outH; r++) {
            for (int c = 0; c < outW; c++) {
                int x = mapped.x[r][c];
                int y = mapped.y[r][c];
                valid[r][c] = x >= 0 && y >= 0
                              && x <= outW - 1 && y <= outH - 1
                              && x <= tgtW - 1 && y <= tgtH - 1;
            }
        }
        return new ValidityMask(valid);
    }

    public Raster resample(RasterShape outputShape, Raster target, MappedCoordinateField mapped) {
        return resample(outputShape, target, mapped, validityMask(outputShape, target, mapped));
    }

    public Raster resample(RasterShape outputShape, Raster target, MappedCoordinateField mapped, ValidityMask mask) {
        outputShape.requireSame("resample", mapped.shape);
        outputShape.requireSame("resample mask", mask.shape());

        double[][] out = new double[outputShape.height][outputShape.width];
        for (int r = 0; r < outputShape.height; r++) {
            for (int c = 0; c < outputShape.width; c++) {
                if (mask.isValid(r, c)) {
                    out[r][c] = target.get(mapped.y[r][c], mapped.x[r][c]);
                } else if (policy == MissingValuePolicy.MASK_ONLY) {
                    out[r][c] = missingValue;
                }
            }
        }

        if (policy == MissingValuePolicy.ZERO_AS_MISSING) {
            // Un cero real del target también se marca como dato faltante
            for (double[] row : out) {
                for (int c = 0; c < row.length; c++) {
                    if (row[c] == 0.0) row[c] = missingValue;
                }
            }
        }
        return new Raster(out);
    }
}
