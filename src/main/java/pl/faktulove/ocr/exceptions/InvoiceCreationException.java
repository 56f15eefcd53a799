package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

/**
 * The downstream invoice store refused or failed to create the invoice.
 */
public class InvoiceCreationException extends PipelineException {

    public InvoiceCreationException(String message, Throwable cause) {
        super("InvoiceStoreUnavailable", Response.Status.BAD_GATEWAY, message, cause);
    }
}
