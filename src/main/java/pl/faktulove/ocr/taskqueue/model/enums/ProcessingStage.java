package pl.faktulove.ocr.taskqueue.model.enums;

/**
 * Discrete progress checkpoints reported by a worker.
 */
public enum ProcessingStage {
    UPLOAD_VERIFIED(10),
    PREPROCESSED(30),
    RECOGNIZED(60),
    FIELDS_MAPPED(90),
    PERSISTED(100);

    private final int percent;

    ProcessingStage(int percent) {
        this.percent = percent;
    }

    public int getPercent() {
        return percent;
    }
}
