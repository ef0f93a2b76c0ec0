package com.cred.freestyle.stockcount.exception;

/**
 * Exception thrown when a requested stock count does not exist.
 *
 * @author Stock Count Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException stockCount(Integer stockCountId) {
        return new ResourceNotFoundException(
                "StockCount",
                String.valueOf(stockCountId),
                String.format("No stock count found with id %s", stockCountId)
        );
    }

    public static ResourceNotFoundException stockCountAtLocation(Integer locationId) {
        String message = locationId == null
                ? "No stock count in progress"
                : String.format("No stock count in progress for location %s", locationId);
        return new ResourceNotFoundException("StockCount", String.valueOf(locationId), message);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
