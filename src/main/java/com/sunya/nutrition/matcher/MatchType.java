package com.sunya.nutrition.matcher;

/** Match tiers in priority order. */
public enum MatchType {
    EXACT(100),
    SYNONYM(95),
    PARTIAL(80),
    SIMILAR(-1),
    NONE(0);

    private final int fixedScore;

    MatchType(int fixedScore) {
        this.fixedScore = fixedScore;
    }

    /** Score assigned by tier; SIMILAR scores are computed instead. */
    public int fixedScore() {
        return fixedScore;
    }
}
