package pl.faktulove.ocr.documentservice.dto;

public record UploadReceipt(String taskId, String documentId, long etaSeconds) {
}
