package pl.faktulove.ocr.validationservice.services;

import java.util.Map;

/**
 * Downstream invoice bookkeeping.
 */
public interface InvoiceStore {

    /**
     * Creates an invoice from validated OCR fields.
     *
     * @return the reference of the created invoice
     * @throws pl.faktulove.ocr.exceptions.InvoiceCreationException if the invoice could not be created
     */
    String create(String resultId, String ownerId, Map<String, String> fields);
}
