package pl.faktulove.ocr.resultservice.resources;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import pl.faktulove.ocr.resultservice.dto.OcrResultResponse;
import pl.faktulove.ocr.resultservice.dto.OcrResultSummary;
import pl.faktulove.ocr.resultservice.services.OcrResultService;
import pl.faktulove.ocr.security.UserContext;

import java.util.List;

@JBossLog
@Tag(name = "ocr-results")
@Path("/ocr/results")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OcrResultResource {

    @Inject
    OcrResultService resultService;

    @Inject
    UserContext userContext;

    @GET
    @Operation(summary = "List the caller's OCR results, newest first")
    public List<OcrResultSummary> list() {
        String caller = userContext.currentCaller();
        log.infof("GET /ocr/results by user %s", caller);
        return resultService.listResults(caller);
    }

    @GET
    @Path("/{resultId}")
    @Operation(summary = "Get extracted fields and confidence of a result")
    public OcrResultResponse get(@PathParam("resultId") String resultId) {
        String caller = userContext.currentCaller();
        log.infof("GET /ocr/results/%s by user %s", resultId, caller);
        return resultService.getResult(resultId, caller);
    }
}
