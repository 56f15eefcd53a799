package pl.faktulove.ocr.validationservice.network;

import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import jakarta.ws.rs.*;

@Path("/invoices")
@RegisterRestClient(configKey = "invoice-store")
@Produces("application/json")
@Consumes("application/json")
public interface InvoiceAPI {

    @POST
    @Path("/from-ocr")
    CreateInvoiceResponse createFromOcr(CreateInvoiceRequest request);
}
