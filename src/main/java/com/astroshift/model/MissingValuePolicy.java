package com.astroshift.model;

public enum MissingValuePolicy {
    /**
     * Fill with zero, copy valid samples, then turn every exact zero into the sentinel.
     * A real zero sample from the target is indistinguishable from missing data.
     */
    ZERO_AS_MISSING,
    /**
     * Only positions rejected by the validity mask receive the sentinel.
     */
    MASK_ONLY
}
