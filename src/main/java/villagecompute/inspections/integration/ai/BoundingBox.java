package villagecompute.inspections.integration.ai;

/**
 * Region of an image in normalized coordinates (0..1, origin top-left).
 */
public record BoundingBox(double x, double y, double width, double height) {
}
