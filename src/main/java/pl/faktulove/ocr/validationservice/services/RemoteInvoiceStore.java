package pl.faktulove.ocr.validationservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import pl.faktulove.ocr.exceptions.InvoiceCreationException;
import pl.faktulove.ocr.validationservice.network.CreateInvoiceRequest;
import pl.faktulove.ocr.validationservice.network.CreateInvoiceResponse;
import pl.faktulove.ocr.validationservice.network.InvoiceAPI;

import java.util.Map;

/**
 * {@link InvoiceStore} backed by the invoice service's REST API. Never retries; a failed
 * call fails the validation request that triggered it.
 */
@JBossLog
@ApplicationScoped
public class RemoteInvoiceStore implements InvoiceStore {

    @Inject
    @RestClient
    InvoiceAPI invoiceAPI;

    @Override
    public String create(String resultId, String ownerId, Map<String, String> fields) {
        try {
            CreateInvoiceResponse response = invoiceAPI.createFromOcr(new CreateInvoiceRequest(resultId, ownerId, fields));
            if (response == null || response.uuid() == null) {
                throw new InvoiceCreationException("Invoice service returned no invoice reference", null);
            }
            log.infof("Invoice %s created from OCR result %s", response.uuid(), resultId);
            return response.uuid();
        } catch (WebApplicationException e) {
            log.errorf(e, "Invoice service rejected OCR result %s", resultId);
            throw new InvoiceCreationException("Invoice service error: " + e.getMessage(), e);
        } catch (ProcessingException e) {
            log.errorf(e, "Invoice service unreachable for OCR result %s", resultId);
            throw new InvoiceCreationException("Invoice service unreachable: " + e.getMessage(), e);
        }
    }
}
