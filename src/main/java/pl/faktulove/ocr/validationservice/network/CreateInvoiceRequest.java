package pl.faktulove.ocr.validationservice.network;

import java.util.Map;

/**
 * Body of the invoice store's create call: the validated field values keyed by field
 * name, plus the OCR result they came from.
 */
public record CreateInvoiceRequest(String ocrResultId, String ownerId, Map<String, String> fields) {
}
