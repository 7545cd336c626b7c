package com.astroshift.model;

public class ValidityMask {

    private final boolean[][] valid;
    private final RasterShape shape;
    private final int validCount;

    public ValidityMask(boolean[][] valid) {
        this.shape = new RasterShape(valid.length, valid.length == 0 ? 0 : valid[0].length);
        int count = 0;
        boolean[][] copy = new boolean[valid.length][];
        for (int r = 0; r < valid.length; r++) {
            if (valid[r].length != shape.width) {
                throw new ShapeMismatchException("validity mask", shape, "row of " + valid[r].length);
            }
            copy[r] = valid[r].clone();
            for (boolean v : copy[r]) if (v) count++;
        }
        this.valid = copy;
        this.validCount = count;
    }

    public boolean isValid(int row, int col) {
        return valid[row][col];
    }

    public RasterShape shape() { return shape; }

    public int validCount() { return validCount; }

    public int invalidCount() { return shape.pixelCount() - validCount; }
}
