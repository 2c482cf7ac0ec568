package villagecompute.inspections.integration.ai;

import java.util.List;

/**
 * One finding from image analysis.
 *
 * @param description
 *            what the violation is
 * @param location
 *            where in the image, in words
 * @param boundingBox
 *            optional region, {@code null} when the model gave none
 * @param confidence
 *            model confidence
 * @param category
 *            OSHA category, e.g. "Fall Protection"
 * @param severity
 *            estimated severity
 * @param suggestedRegulations
 *            standard numbers the model suggests, e.g. {@code 1926.501(b)(1)}
 */
public record PotentialViolation(String description, String location, BoundingBox boundingBox, Confidence confidence,
        String category, Severity severity, List<String> suggestedRegulations) {

    public PotentialViolation {
        suggestedRegulations = suggestedRegulations == null ? List.of() : List.copyOf(suggestedRegulations);
    }
}
