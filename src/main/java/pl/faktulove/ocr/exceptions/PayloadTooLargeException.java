package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

public class PayloadTooLargeException extends PipelineException {

    private final long sizeBytes;
    private final long maxSizeBytes;

    public PayloadTooLargeException(long sizeBytes, long maxSizeBytes) {
        super("PayloadTooLarge", Response.Status.REQUEST_ENTITY_TOO_LARGE,
                String.format("Document is %d bytes, the limit is %d bytes", sizeBytes, maxSizeBytes));
        this.sizeBytes = sizeBytes;
        this.maxSizeBytes = maxSizeBytes;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }
}
