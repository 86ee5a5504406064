package net.chapterone.exception;

/**
 * A referenced arm, impression or book does not exist.
 * Batch work logs and skips it; request handlers surface it as 404.
 */
public class ResourceNotFoundException extends RecommendationCoreException {
    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId, true, null);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
