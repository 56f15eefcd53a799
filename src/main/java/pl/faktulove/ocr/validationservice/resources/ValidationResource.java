package pl.faktulove.ocr.validationservice.resources;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.validationservice.dto.ValidationRecordResponse;
import pl.faktulove.ocr.validationservice.dto.ValidationRequest;
import pl.faktulove.ocr.validationservice.dto.ValidationResponse;
import pl.faktulove.ocr.validationservice.services.ValidationService;

import java.util.List;

@JBossLog
@Tag(name = "ocr-validation")
@Path("/ocr/results/{resultId}/validation")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ValidationResource {

    @Inject
    ValidationService validationService;

    @Inject
    UserContext userContext;

    /**
     * Apply manual corrections to a result.
     *
     * @param resultId The OCR result
     * @param request  Field name to corrected value
     * @return Updated confidences and whether an invoice was created
     */
    @POST
    @Operation(summary = "Correct extracted fields")
    public ValidationResponse validate(@PathParam("resultId") String resultId, ValidationRequest request) {
        String caller = userContext.currentCaller();
        log.infof("POST /ocr/results/%s/validation by user %s", resultId, caller);
        return validationService.validate(resultId, request == null ? null : request.corrections(), caller);
    }

    @GET
    @Operation(summary = "List corrections applied to a result")
    public List<ValidationRecordResponse> history(@PathParam("resultId") String resultId) {
        String caller = userContext.currentCaller();
        log.infof("GET /ocr/results/%s/validation by user %s", resultId, caller);
        return validationService.history(resultId, caller);
    }
}
