package com.astroshift.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_ORIGIN = "pixel_origin";
    private static final String KEY_MISSING_POLICY = "missing_policy";
    private static final String KEY_MISSING_VALUE = "missing_value";
    private static final String KEY_OVERWRITE = "overwrite_output";

    // Origen 0 = índices Java; 1 = convención FITS/DS9
    public static PixelOrigin getPixelOrigin() { return PixelOrigin.of(prefs.getInt(KEY_ORIGIN, 0)); }
    public static void setPixelOrigin(PixelOrigin v) { prefs.putInt(KEY_ORIGIN, v.offset); }

    public static MissingValuePolicy getMissingPolicy() {
        String v = prefs.get(KEY_MISSING_POLICY, MissingValuePolicy.ZERO_AS_MISSING.name());
        try {
            return MissingValuePolicy.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + KEY_MISSING_POLICY + " preference: " + v, e);
        }
    }
    public static void setMissingPolicy(MissingValuePolicy v) { prefs.put(KEY_MISSING_POLICY, v.name()); }

    // NaN se ve como espacio en blanco en DS9
    public static double getMissingValue() { return prefs.getDouble(KEY_MISSING_VALUE, Double.NaN); }
    public static void setMissingValue(double v) { prefs.putDouble(KEY_MISSING_VALUE, v); }

    public static boolean getOverwriteOutput() { return prefs.getBoolean(KEY_OVERWRITE, true); }
    public static void setOverwriteOutput(boolean v) { prefs.putBoolean(KEY_OVERWRITE, v); }
}
