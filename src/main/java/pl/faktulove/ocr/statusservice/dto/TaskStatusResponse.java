package pl.faktulove.ocr.statusservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        String taskId,
        String documentId,
        TaskState state,
        int progressPercent,
        long etaSeconds,
        String resultRef,
        int attemptCount,
        LastError lastError,
        long pollIntervalMillis,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
