package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@Provider
public class PipelineExceptionMapper implements ExceptionMapper<PipelineException> {

    @Override
    public Response toResponse(PipelineException exception) {
        log.debugf("Returning %d %s: %s", exception.getStatus().getStatusCode(),
                exception.getErrorCode(), exception.getMessage());

        Long retryAfter = null;
        if (exception instanceof QuotaExceededException quota) {
            retryAfter = quota.getRetryAfterSeconds();
        }
        ErrorResponse body = new ErrorResponse(
                exception.getErrorCode(),
                exception.getMessage(),
                exception instanceof FieldValidationException fve ? fve.getFieldErrors() : null,
                retryAfter);

        Response.ResponseBuilder builder = Response.status(exception.getStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(body);
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, retryAfter);
        }
        return builder.build();
    }
}
