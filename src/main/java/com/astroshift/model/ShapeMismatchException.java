package com.astroshift.model;

public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String stage, RasterShape expected, String actual) {
        super(stage + ": expected shape " + expected + " but found " + actual);
    }
}
