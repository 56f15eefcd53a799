package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

public class OwnershipException extends PipelineException {

    public OwnershipException(String resourceType, String resourceId) {
        super("Forbidden", Response.Status.FORBIDDEN,
                String.format("Access to %s %s is not allowed", resourceType, resourceId));
    }
}
