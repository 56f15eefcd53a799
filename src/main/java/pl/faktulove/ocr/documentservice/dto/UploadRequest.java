package pl.faktulove.ocr.documentservice.dto;

/**
 * @param fileContent base64 encoded file bytes
 * @param filename    original file name
 * @param mimeType    declared MIME type; derived from the file name when absent
 */
public record UploadRequest(String fileContent, String filename, String mimeType) {
}
