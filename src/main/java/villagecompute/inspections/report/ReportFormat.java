package villagecompute.inspections.report;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output formats a report can be generated in.
 */
public enum ReportFormat {

    PDF("pdf", "application/pdf"),

    DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final String value;
    private final String contentType;

    ReportFormat(String value, String contentType) {
        this.value = value;
        this.contentType = contentType;
    }

    /**
     * Payload value and file extension.
     */
    public String getValue() {
        return value;
    }

    public String getContentType() {
        return contentType;
    }

    public static Optional<ReportFormat> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(format -> format.value.equalsIgnoreCase(value.trim())).findFirst();
    }
}
