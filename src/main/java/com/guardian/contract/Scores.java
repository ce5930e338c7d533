package com.guardian.contract;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Numeric conventions shared by verdicts, indices and ledger records: every
 * score lives in [0,1] and carries four decimal places.
 */
public final class Scores {

    public static final int SCALE = 4;

    private Scores() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("score cannot be NaN");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double round(double value) {
        return toDecimal(value).doubleValue();
    }

    public static BigDecimal toDecimal(double value) {
        return BigDecimal.valueOf(clamp(value)).setScale(SCALE, RoundingMode.HALF_EVEN);
    }
}
