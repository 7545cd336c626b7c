package com.astroshift.service;

import com.astroshift.model.CoordinateGrid;
import com.astroshift.model.MappedCoordinateField;
import com.astroshift.model.PixelCoordinateField;
import com.astroshift.model.PixelOrigin;
import com.astroshift.model.RasterShape;
import com.astroshift.model.SkyCoordinateField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CoordinateMapper {

    private final GridGenerator gridGenerator;

    public CoordinateMapper() {
        this(new GridGenerator());
    }

    public CoordinateMapper(GridGenerator gridGenerator) {
        this.gridGenerator = gridGenerator;
    }

    public MappedCoordinateField map(RasterShape sourceShape,
                                     AstrometricTransform source,
                                     AstrometricTransform target) {
        return map(sourceShape, source, target, PixelOrigin.ZERO);
    }

    /**
     * Composes {@code source.pixelToSky} with {@code target.skyToPixel} and rounds the result.
     * The returned indices are 0-based whatever the origin; the origin only sets how pixel
     * coordinates are handed to the transforms. NaN and infinite results are not filtered here.
     *
     * @throws com.astroshift.model.ShapeMismatchException
     *   if a transform returns a field whose shape differs from {@code sourceShape}.
     */
    public MappedCoordinateField map(RasterShape sourceShape,
                                     AstrometricTransform source,
                                     AstrometricTransform target,
                                     PixelOrigin origin) {

        LOG.debug("map: entry, sourceShape={}, origin={}", sourceShape, origin);

        CoordinateGrid grid = gridGenerator.generate(sourceShape);

        // La rejilla son índices de array (base 0); se pasan a la convención del origen y se vuelven a quitar
        SkyCoordinateField sky = source.pixelToSky(offset(grid.xAsDouble(), origin.offset),
                                                   offset(grid.yAsDouble(), origin.offset),
                                                   origin);
        sourceShape.requireSame("pixelToSky", sky.shape);

        PixelCoordinateField pixels = target.skyToPixel(sky.ra, sky.dec, origin);
        sourceShape.requireSame("skyToPixel", pixels.shape);

        if (origin.offset != 0) {
            pixels = new PixelCoordinateField(offset(pixels.x, -origin.offset), offset(pixels.y, -origin.offset));
        }
        return roundToIndex(pixels);
    }

    private static double[][] offset(double[][] values, int delta) {
        if (delta == 0) return values;
        double[][] d = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            d[r] = new double[values[r].length];
            for (int c = 0; c < values[r].length; c++) d[r][c] = values[r][c] + delta;
        }
        return d;
    }

    /**
     * Rounds half to even ({@link Math#rint}). NaN becomes {@link Integer#MIN_VALUE};
     * infinite and out-of-range values saturate to the int limits.
     */
    public MappedCoordinateField roundToIndex(PixelCoordinateField pixels) {
        int h = pixels.shape.height, w = pixels.shape.width;
        int[][] x = new int[h][w];
        int[][] y = new int[h][w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                x[r][c] = toIndex(pixels.x[r][c]);
                y[r][c] = toIndex(pixels.y[r][c]);
            }
        }
        return new MappedCoordinateField(x, y);
    }

    static int toIndex(double v) {
        // (int) NaN es 0, que pasaría como índice válido
        if (Double.isNaN(v)) return Integer.MIN_VALUE;
        return (int) Math.rint(v);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CoordinateMapper.class);
}
