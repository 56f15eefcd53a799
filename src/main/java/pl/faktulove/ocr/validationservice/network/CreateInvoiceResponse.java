package pl.faktulove.ocr.validationservice.network;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateInvoiceResponse(String uuid) {
}
