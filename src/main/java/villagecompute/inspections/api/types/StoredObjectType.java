package villagecompute.inspections.api.types;

/**
 * Kind of object kept in the inspections bucket, used to tag storage metrics and spans.
 */
public enum StoredObjectType {
    IMAGE, THUMBNAIL, REPORT;

    public String tag() {
        return name().toLowerCase();
    }
}
