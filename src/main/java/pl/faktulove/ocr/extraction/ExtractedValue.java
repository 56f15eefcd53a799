package pl.faktulove.ocr.extraction;

import pl.faktulove.ocr.engine.RecognitionOutput;

/**
 * A value located in the recognized text, with the engine confidence of its span.
 * A null value means the field was not found.
 */
public record ExtractedValue(String value, double engineConfidence, int start, int end) {

    public static ExtractedValue notFound() {
        return new ExtractedValue(null, 0, -1, -1);
    }

    public static ExtractedValue ofSpan(RecognitionOutput output, String value, int start, int end) {
        return new ExtractedValue(value, output.confidenceForSpan(start, end), start, end);
    }

    public boolean isFound() {
        return value != null;
    }
}
