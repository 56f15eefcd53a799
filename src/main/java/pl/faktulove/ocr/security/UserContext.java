package pl.faktulove.ocr.security;

import java.util.Optional;

/**
 * Identity and ownership lookups.
 */
public interface UserContext {

    /**
     * Owner identity of the current request.
     */
    String currentCaller();

    /**
     * Owner of an uploaded document, empty when the document does not exist.
     */
    Optional<String> ownerOf(String documentId);
}
