package com.vapeshop.shop.exception;

/**
 * Exception thrown when no record exists at the requested id or code.
 *
 * @author Vape Shop Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(String.format("%s %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
