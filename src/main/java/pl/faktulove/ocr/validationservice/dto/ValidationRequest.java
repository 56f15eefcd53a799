package pl.faktulove.ocr.validationservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Manual corrections: invoice field name to corrected value.
 *
 * <pre>
 * { "corrections": { "seller_tax_id": "526-104-08-28", "vat_rate": "23%" } }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationRequest(Map<String, String> corrections) {
}
