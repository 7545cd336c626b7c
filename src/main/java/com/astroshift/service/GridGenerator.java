package com.astroshift.service;

import com.astroshift.model.CoordinateGrid;
import com.astroshift.model.RasterShape;

public class GridGenerator {

    public CoordinateGrid generate(int height, int width) throws IllegalArgumentException {
        return generate(new RasterShape(height, width));
    }

    public CoordinateGrid generate(RasterShape shape) {
        int[][] x = new int[shape.height][shape.width];
        int[][] y = new int[shape.height][shape.width];
        for (int r = 0; r < shape.height; r++) {
            for (int c = 0; c < shape.width; c++) {
                x[r][c] = c;
                y[r][c] = r;
            }
        }
        return new CoordinateGrid(x, y);
    }
}
