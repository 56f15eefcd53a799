package pl.faktulove.ocr.documentservice.services;

/**
 * Per-owner upload quota. The counter is shared by all concurrent uploads of an owner.
 */
public interface UploadThrottle {

    /**
     * Takes one unit of the owner's quota if any is left.
     */
    ThrottleDecision tryAcquire(String ownerId);

    /**
     * Gives back a unit taken by {@link #tryAcquire(String)} for an upload that was not admitted.
     */
    void release(String ownerId);
}
