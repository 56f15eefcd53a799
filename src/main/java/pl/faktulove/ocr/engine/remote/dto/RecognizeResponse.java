package pl.faktulove.ocr.engine.remote.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of the OCR server. Confidences are reported on a 0..1 scale.
 *
 * <p>Example response:
 * <pre>
 * {
 *   "engine": "tesseract-5.3",
 *   "text": "Faktura VAT nr FV/2024/001 ...",
 *   "confidence": 0.91,
 *   "tokens": [
 *     {"text": "Faktura", "confidence": 0.97, "page": 1, "x": 112, "y": 80, "width": 140, "height": 28}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecognizeResponse(
        String engine,
        String text,
        Double confidence,
        List<Token> tokens
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Token(
            String text,
            double confidence,
            int page,
            int x,
            int y,
            int width,
            int height
    ) {
    }
}
