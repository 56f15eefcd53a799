package pl.faktulove.ocr.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.extractors.AmountExtractor;
import pl.faktulove.ocr.extraction.extractors.BankAccountExtractor;
import pl.faktulove.ocr.extraction.extractors.CurrencyExtractor;
import pl.faktulove.ocr.extraction.extractors.DateExtractor;
import pl.faktulove.ocr.extraction.extractors.InvoiceNumberExtractor;
import pl.faktulove.ocr.extraction.extractors.LineItemExtractor;
import pl.faktulove.ocr.extraction.extractors.TaxIdExtractor;
import pl.faktulove.ocr.extraction.extractors.VatRateExtractor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every extractor over the recognized text and assembles the full field set.
 * Fields no extractor found are present with a null value and confidence 0.
 */
@JBossLog
@Singleton
public class InvoiceFieldExtractionService {

    private final List<FieldExtractor> extractors;

    @Inject
    public InvoiceFieldExtractionService(ObjectMapper objectMapper) {
        this(List.of(
                new InvoiceNumberExtractor(),
                new DateExtractor(),
                new TaxIdExtractor(),
                new AmountExtractor(),
                new VatRateExtractor(),
                new CurrencyExtractor(),
                new LineItemExtractor(objectMapper),
                new BankAccountExtractor()));
    }

    InvoiceFieldExtractionService(List<FieldExtractor> extractors) {
        this.extractors = extractors;
    }

    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        Map<InvoiceField, ExtractedValue> fields = new EnumMap<>(InvoiceField.class);
        for (FieldExtractor extractor : extractors) {
            try {
                extractor.extract(output).forEach(fields::putIfAbsent);
            } catch (RuntimeException e) {
                log.warnf(e, "Extractor %s failed, its fields stay unresolved", extractor.name());
            }
        }
        for (InvoiceField field : InvoiceField.values()) {
            fields.putIfAbsent(field, ExtractedValue.notFound());
        }
        long unresolved = fields.values().stream().filter(v -> !v.isFound()).count();
        log.debugf("Extracted %d of %d invoice fields", fields.size() - unresolved, fields.size());
        return fields;
    }
}
