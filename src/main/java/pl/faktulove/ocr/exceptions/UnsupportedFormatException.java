package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

public class UnsupportedFormatException extends PipelineException {

    public UnsupportedFormatException(String message) {
        super("UnsupportedFormat", Response.Status.UNSUPPORTED_MEDIA_TYPE, message);
    }
}
