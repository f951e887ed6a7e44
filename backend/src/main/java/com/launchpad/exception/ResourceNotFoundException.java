package com.launchpad.exception;

/**
 * Exception thrown when a named resource (such as a job queue) does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceName;

    public ResourceNotFoundException(String resourceType, String resourceName) {
        super(String.format("%s '%s' does not exist.", resourceType, resourceName));
        this.resourceType = resourceType;
        this.resourceName = resourceName;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceName() {
        return resourceName;
    }

    public static ResourceNotFoundException queue(String name) {
        return new ResourceNotFoundException("Queue", name);
    }
}
