package pl.faktulove.ocr.engine;

/**
 * A text recognition backend.
 */
public interface OcrEngine {

    /**
     * Recognizes the text of a document.
     *
     * @param content  the stored document bytes
     * @param mimeType the sniffed content type
     * @throws EngineFailureException when recognition fails; the exception says whether
     *                                retrying can help
     */
    RecognitionOutput recognize(byte[] content, String mimeType) throws EngineFailureException;

    /**
     * Identity used for outputs that do not name their engine.
     */
    String engineId();
}
