package pl.faktulove.ocr.confidence;

public enum ConfidenceLevel {
    /** At or above the auto-approve threshold. */
    HIGH,
    /** Good enough to skip review, below auto-approve. */
    MEDIUM,
    /** Needs review. */
    LOW
}
