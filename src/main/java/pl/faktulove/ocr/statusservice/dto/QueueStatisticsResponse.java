package pl.faktulove.ocr.statusservice.dto;

public record QueueStatisticsResponse(
        long pending,
        long processing,
        long completed,
        long failed,
        long cancelled,
        int workerSlots,
        double meanProcessingSeconds
) {
}
