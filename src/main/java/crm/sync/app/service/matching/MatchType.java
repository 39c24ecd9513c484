package crm.sync.app.service.matching;

public enum MatchType {
    EXACT(1.0),
    FUZZY(0.85),
    POTENTIAL(0.70);

    private final double threshold;

    MatchType(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Returns the strongest type the score reaches, or null below the POTENTIAL threshold.
     */
    public static MatchType forScore(double score) {
        for (MatchType type : values()) {
            if (score >= type.threshold) {
                return type;
            }
        }
        return null;
    }
}
