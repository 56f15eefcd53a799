package pl.faktulove.ocr.extraction;

import pl.faktulove.ocr.engine.RecognitionOutput;

import java.util.Map;

/**
 * Locates and parses one kind of invoice field in recognized text. Implementations are
 * pure functions of their input.
 */
public interface FieldExtractor {

    String name();

    /**
     * @return the fields found; fields that were not found are absent from the map
     */
    Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output);
}
