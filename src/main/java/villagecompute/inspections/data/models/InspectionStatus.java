package villagecompute.inspections.data.models;

/**
 * Lifecycle of an inspection.
 *
 * <p>
 * draft → analyzing → review → completed, with completed → review for corrections, review → analyzing when new
 * photos are analyzed, and any status → draft.
 */
public enum InspectionStatus {
    DRAFT("draft"),
    ANALYZING("analyzing"),
    REVIEW("review"),
    COMPLETED("completed");

    private final String value;

    InspectionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(InspectionStatus target) {
        if (target == DRAFT) {
            return true;
        }
        switch (this) {
            case DRAFT:
                return target == ANALYZING;
            case ANALYZING:
                return target == REVIEW;
            case REVIEW:
                return target == COMPLETED || target == ANALYZING;
            case COMPLETED:
                return target == REVIEW;
            default:
                return false;
        }
    }
}
