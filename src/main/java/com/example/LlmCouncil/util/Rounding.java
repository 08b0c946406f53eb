package com.example.LlmCouncil.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boundary rounding for values leaving the service.
 * Internal state always keeps full double precision.
 */
public final class Rounding {

    private static final int PERCENT_SCALE = 1;
    private static final int CURRENCY_SCALE = 4;

    private Rounding() {
    }

    public static double percent(double value) {
        return round(value, PERCENT_SCALE);
    }

    public static double currency(double value) {
        return round(value, CURRENCY_SCALE);
    }

    public static Map<String, Double> percents(Map<String, Double> values) {
        if (values == null) {
            return null;
        }
        Map<String, Double> rounded = new LinkedHashMap<>();
        values.forEach((k, v) -> rounded.put(k, v == null ? null : percent(v)));
        return rounded;
    }

    private static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
