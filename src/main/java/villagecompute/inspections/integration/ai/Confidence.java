package villagecompute.inspections.integration.ai;

/**
 * How sure the model is about a finding.
 */
public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses a model-supplied value; anything unrecognized becomes {@link #MEDIUM}.
     */
    public static Confidence fromValue(String value) {
        for (Confidence confidence : values()) {
            if (confidence.value.equalsIgnoreCase(value)) {
                return confidence;
            }
        }
        return MEDIUM;
    }
}
