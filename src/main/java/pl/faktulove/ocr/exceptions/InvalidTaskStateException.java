package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

public class InvalidTaskStateException extends PipelineException {

    public InvalidTaskStateException(String message) {
        super("InvalidState", Response.Status.CONFLICT, message);
    }
}
