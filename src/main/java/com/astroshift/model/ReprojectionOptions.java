package com.astroshift.model;

public class ReprojectionOptions {

    public PixelOrigin origin = PixelOrigin.ZERO;
    public MissingValuePolicy missingPolicy = MissingValuePolicy.ZERO_AS_MISSING;
    public double missingValue = Double.NaN;
    public boolean overwrite = true;

    public static ReprojectionOptions fromConfig() {
        ReprojectionOptions o = new ReprojectionOptions();
        o.origin = AppConfig.getPixelOrigin();
        o.missingPolicy = AppConfig.getMissingPolicy();
        o.missingValue = AppConfig.getMissingValue();
        o.overwrite = AppConfig.getOverwriteOutput();
        return o;
    }

    @Override
    public String toString() {
        return "origin=" + origin.offset + ", missingPolicy=" + missingPolicy +
               ", missingValue=" + missingValue + ", overwrite=" + overwrite;
    }
}
