package villagecompute.inspections.data.models;

/**
 * AI analysis state of a single inspection image, mutated independently of the inspection.
 */
public enum ImageAnalysisStatus {
    PENDING("pending"),
    ANALYZING("analyzing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ImageAnalysisStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
