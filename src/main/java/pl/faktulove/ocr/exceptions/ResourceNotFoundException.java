package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

public class ResourceNotFoundException extends PipelineException {

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super("NotFound", Response.Status.NOT_FOUND,
                String.format("%s %s not found", resourceType, resourceId));
    }
}
