package pl.faktulove.ocr.documentservice.services;

/**
 * @param allowed           whether the upload may proceed
 * @param retryAfterSeconds seconds until the current window closes, 0 when allowed
 */
public record ThrottleDecision(boolean allowed, long retryAfterSeconds) {

    public static ThrottleDecision allow() {
        return new ThrottleDecision(true, 0);
    }

    public static ThrottleDecision deny(long retryAfterSeconds) {
        return new ThrottleDecision(false, Math.max(1, retryAfterSeconds));
    }
}
