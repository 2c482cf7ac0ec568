package villagecompute.inspections.api.types;

/**
 * Object bytes as downloaded, with the {@code Content-Type} recorded in storage (null when the object has none).
 */
public record StoredObject(byte[] data, String contentType) {

    /**
     * Stored content type, or {@code fallback} when storage has none.
     */
    public String contentTypeOr(String fallback) {
        return contentType == null || contentType.isBlank() ? fallback : contentType;
    }
}
