package com.phillippitts.jobpipeline.exception;

import com.phillippitts.jobpipeline.domain.ErrorKind;

/**
 * Thrown when a job or session id does not resolve to a record.
 */
public class NotFoundException extends JobPipelineException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(ErrorKind.NOT_FOUND, resourceType + " not found: " + resourceId);
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
