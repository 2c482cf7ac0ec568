package villagecompute.inspections.integration.ai;

/**
 * OSHA-style severity of a finding.
 */
public enum Severity {
    /**
     * Imminent danger.
     */
    CRITICAL("critical"),

    /**
     * Hazard with potential for severe injury.
     */
    SERIOUS("serious"),

    /**
     * Violation below the serious threshold.
     */
    OTHER("other"),

    /**
     * Best practice, possibly not a regulatory violation.
     */
    RECOMMENDATION("recommendation");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses a model-supplied value; anything unrecognized becomes {@link #OTHER}.
     */
    public static Severity fromValue(String value) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        return OTHER;
    }
}
