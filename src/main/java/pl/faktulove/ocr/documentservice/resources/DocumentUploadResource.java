package pl.faktulove.ocr.documentservice.resources;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import pl.faktulove.ocr.documentservice.dto.UploadReceipt;
import pl.faktulove.ocr.documentservice.dto.UploadRequest;
import pl.faktulove.ocr.documentservice.services.UploadGatewayService;
import pl.faktulove.ocr.exceptions.FieldValidationException;
import pl.faktulove.ocr.security.UserContext;

import java.util.Base64;
import java.util.Map;

@JBossLog
@Tag(name = "ocr-documents")
@Path("/ocr/documents")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DocumentUploadResource {

    @Inject
    UploadGatewayService uploadGatewayService;

    @Inject
    UserContext userContext;

    /**
     * Upload an invoice scan for OCR processing.
     *
     * @param request Base64 file content with its name and declared type
     * @return 201 with the task id to poll and an estimated time to completion
     */
    @POST
    @Operation(summary = "Upload a document for OCR")
    public Response upload(UploadRequest request) {
        String caller = userContext.currentCaller();
        log.infof("POST /ocr/documents by user %s", caller);
        if (request == null || request.fileContent() == null || request.fileContent().isBlank()) {
            throw new FieldValidationException(Map.of("fileContent", "File content is required"));
        }
        byte[] content;
        try {
            content = Base64.getMimeDecoder().decode(request.fileContent());
        } catch (IllegalArgumentException e) {
            throw new FieldValidationException(Map.of("fileContent", "File content is not valid base64"));
        }
        UploadReceipt receipt = uploadGatewayService.upload(content, request.filename(), request.mimeType(), caller);
        return Response.status(Response.Status.CREATED).entity(receipt).build();
    }

    @POST
    @Path("/{documentId}/reprocess")
    @Operation(summary = "Queue a failed or cancelled document again")
    public Response reprocess(@PathParam("documentId") String documentId) {
        String caller = userContext.currentCaller();
        log.infof("POST /ocr/documents/%s/reprocess by user %s", documentId, caller);
        return Response.accepted(uploadGatewayService.reprocess(documentId, caller)).build();
    }
}
