package pl.faktulove.ocr.extraction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.extractors.CurrencyExtractor;
import pl.faktulove.ocr.support.TestDocuments;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InvoiceFieldExtractionService")
class InvoiceFieldExtractionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InvoiceFieldExtractionService service;

    @BeforeEach
    void setUp() {
        service = new InvoiceFieldExtractionService(objectMapper);
    }

    @Test
    @DisplayName("extracts every field of a standard VAT invoice")
    void extractsStandardInvoice() throws Exception {
        // Given
        RecognitionOutput output = RecognitionOutput.withUniformConfidence(TestDocuments.INVOICE_TEXT, 92);

        // When
        Map<InvoiceField, ExtractedValue> fields = service.extract(output);

        // Then
        assertEquals("FV/2024/03/001", fields.get(InvoiceField.INVOICE_NUMBER).value());
        assertEquals("2024-03-15", fields.get(InvoiceField.ISSUE_DATE).value());
        assertEquals("2024-03-14", fields.get(InvoiceField.SALE_DATE).value());
        assertEquals("2024-03-29", fields.get(InvoiceField.DUE_DATE).value());
        assertEquals(TestDocuments.SELLER_NIP, fields.get(InvoiceField.SELLER_TAX_ID).value());
        assertEquals(TestDocuments.BUYER_NIP, fields.get(InvoiceField.BUYER_TAX_ID).value());
        assertEquals("1500.00", fields.get(InvoiceField.NET_AMOUNT).value());
        assertEquals("345.00", fields.get(InvoiceField.VAT_AMOUNT).value());
        assertEquals("1845.00", fields.get(InvoiceField.GROSS_AMOUNT).value());
        assertEquals("23", fields.get(InvoiceField.VAT_RATE).value());
        assertEquals("PLN", fields.get(InvoiceField.CURRENCY).value());
        assertEquals("PL61109010140000071219812874", fields.get(InvoiceField.BANK_ACCOUNT).value());

        List<LineItem> items = objectMapper.readValue(fields.get(InvoiceField.LINE_ITEMS).value(),
                new TypeReference<List<LineItem>>() {});
        assertEquals(1, items.size());
        assertEquals("Usługa programistyczna", items.get(0).name());
        assertEquals(0, new BigDecimal("10").compareTo(items.get(0).quantity()));
        assertEquals(0, new BigDecimal("1500").compareTo(items.get(0).netValue()));

        fields.values().forEach(v -> assertEquals(92, v.engineConfidence(), 0.001));
    }

    @Test
    @DisplayName("every field is present, unresolved ones without a value")
    void unresolvedFieldsArePresent() {
        Map<InvoiceField, ExtractedValue> fields = service.extract(
                RecognitionOutput.withUniformConfidence("Lorem ipsum dolor sit amet", 80));

        assertEquals(InvoiceField.values().length, fields.size());
        assertTrue(fields.values().stream().noneMatch(ExtractedValue::isFound));
    }

    @Test
    @DisplayName("a failing extractor leaves only its own fields unresolved")
    void failingExtractorIsIsolated() {
        // Given
        FieldExtractor broken = new FieldExtractor() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
                throw new IllegalStateException("boom");
            }
        };
        InvoiceFieldExtractionService partial = new InvoiceFieldExtractionService(List.of(broken, new CurrencyExtractor()));

        // When
        Map<InvoiceField, ExtractedValue> fields = partial.extract(
                RecognitionOutput.withUniformConfidence(TestDocuments.INVOICE_TEXT, 90));

        // Then
        assertEquals("PLN", fields.get(InvoiceField.CURRENCY).value());
        assertFalse(fields.get(InvoiceField.INVOICE_NUMBER).isFound());
    }

    @Test
    @DisplayName("field confidence is the weakest token of its span")
    void confidenceFollowsTokens() {
        // Given
        String text = "Do zapłaty: 1845,00 PLN";
        RecognitionOutput uniform = RecognitionOutput.withUniformConfidence(text, 90);
        var tokens = uniform.getTokens().stream()
                .map(t -> t.text().equals("1845,00")
                        ? new pl.faktulove.ocr.engine.RecognizedToken(t.text(), t.start(), t.end(), 41, null)
                        : t)
                .toList();

        // When
        Map<InvoiceField, ExtractedValue> fields = service.extract(new RecognitionOutput(text, tokens));

        // Then
        assertEquals("1845.00", fields.get(InvoiceField.GROSS_AMOUNT).value());
        assertEquals(41, fields.get(InvoiceField.GROSS_AMOUNT).engineConfidence(), 0.001);
    }
}
