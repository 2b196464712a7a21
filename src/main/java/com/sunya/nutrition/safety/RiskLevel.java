package com.sunya.nutrition.safety;

/** Ordered from least to most severe. */
public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    AVOID;

    /** Percentages below this are not reported as a risk at all. */
    public static final double REPORTING_FLOOR_PCT = 10;

    /**
     * @param percentage value as a percentage of the profile's daily limit
     * @return the level, or {@code null} below {@link #REPORTING_FLOOR_PCT}
     */
    public static RiskLevel fromPercentage(double percentage) {
        if (percentage < REPORTING_FLOOR_PCT) return null;
        if (percentage >= 50) return AVOID;
        if (percentage >= 30) return HIGH;
        if (percentage >= 20) return MODERATE;
        return LOW;
    }

    public boolean blocks() {
        return this == HIGH || this == AVOID;
    }
}
