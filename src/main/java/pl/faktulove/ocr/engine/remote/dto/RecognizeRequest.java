package pl.faktulove.ocr.engine.remote.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request body of the OCR server's {@code POST /recognize}.
 *
 * @param content       base64 encoded document
 * @param mimeType      content type of the document
 * @param language      recognition language, e.g. "pol"
 * @param preprocessing image operations the server applies before recognition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecognizeRequest(
        String content,
        String mimeType,
        String language,
        List<String> preprocessing
) {
}
