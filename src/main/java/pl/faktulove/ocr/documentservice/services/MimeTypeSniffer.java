package pl.faktulove.ocr.documentservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.Tika;

import java.util.Locale;
import java.util.Map;

/**
 * Detects the real type of an upload from its magic bytes.
 */
@ApplicationScoped
public class MimeTypeSniffer {

    private static final Map<String, String> ALIASES = Map.of(
            "image/jpg", "image/jpeg",
            "image/pjpeg", "image/jpeg",
            "image/x-png", "image/png",
            "image/tif", "image/tiff",
            "application/x-pdf", "application/pdf");

    private final Tika tika = new Tika();

    public String detect(byte[] content) {
        return normalize(tika.detect(content));
    }

    /**
     * Type implied by the file name extension, {@code application/octet-stream} when unknown.
     */
    public String detectFromName(String filename) {
        return normalize(tika.detect(filename));
    }

    public static String normalize(String mimeType) {
        if (mimeType == null) {
            return null;
        }
        String base = mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(base, base);
    }
}
