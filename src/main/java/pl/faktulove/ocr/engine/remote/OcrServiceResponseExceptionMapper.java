package pl.faktulove.ocr.engine.remote;

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;

/**
 * Turns error responses of the OCR server into {@link OcrServiceApiException}, keeping
 * the status code so the engine can tell transient from permanent failures.
 */
@JBossLog
public class OcrServiceResponseExceptionMapper implements ResponseExceptionMapper<OcrServiceResponseExceptionMapper.OcrServiceApiException> {

    @Override
    public OcrServiceApiException toThrowable(Response response) {
        int status = response.getStatus();
        String body = readResponseBody(response);
        log.warnf("OCR server error - Status: %d, Body: %s", status, body);
        return new OcrServiceApiException(status, body);
    }

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    private String readResponseBody(Response response) {
        try {
            return response.hasEntity() ? response.readEntity(String.class) : "<no response body>";
        } catch (RuntimeException e) {
            log.debugf(e, "Failed to read OCR server error body");
            return "<unreadable body>";
        }
    }

    public static class OcrServiceApiException extends RuntimeException {
        private final int statusCode;

        public OcrServiceApiException(int statusCode, String responseBody) {
            super(String.format("OCR server error %d: %s", statusCode, responseBody));
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }

        /**
         * Server-side errors, throttling and request timeouts may succeed on a later attempt.
         */
        public boolean isRetryable() {
            return statusCode >= 500 || statusCode == 429 || statusCode == 408;
        }
    }
}
