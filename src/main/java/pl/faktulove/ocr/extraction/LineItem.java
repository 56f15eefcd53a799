package pl.faktulove.ocr.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * One row of an invoice item table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LineItem(
        int lineNumber,
        String name,
        BigDecimal quantity,
        String unit,
        BigDecimal unitNetPrice,
        String vatRate,
        BigDecimal netValue,
        BigDecimal grossValue
) {
}
