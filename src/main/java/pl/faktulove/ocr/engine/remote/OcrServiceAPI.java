package pl.faktulove.ocr.engine.remote;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;
import pl.faktulove.ocr.engine.remote.dto.RecognizeRequest;
import pl.faktulove.ocr.engine.remote.dto.RecognizeResponse;

/**
 * MicroProfile REST Client for the OCR recognition server.
 *
 * <p>Configuration in application.properties:
 * <pre>
 * quarkus.rest-client.ocr-service.url=http://ocr-server:8884
 * quarkus.rest-client.ocr-service.read-timeout=120000
 * </pre>
 */
@Path("")
@RegisterRestClient(configKey = "ocr-service")
@RegisterProvider(OcrServiceResponseExceptionMapper.class)
public interface OcrServiceAPI {

    @POST
    @Path("/recognize")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    RecognizeResponse recognize(RecognizeRequest request);
}
