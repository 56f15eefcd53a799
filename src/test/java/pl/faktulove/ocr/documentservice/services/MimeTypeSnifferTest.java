package pl.faktulove.ocr.documentservice.services;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import pl.faktulove.ocr.support.TestDocuments;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MimeTypeSnifferTest {

    private final MimeTypeSniffer sniffer = new MimeTypeSniffer();

    @Test
    void detectsByMagicBytes() {
        assertEquals("application/pdf", sniffer.detect(TestDocuments.pdf(2048)));
        assertEquals("image/jpeg", sniffer.detect(TestDocuments.jpeg()));
        assertEquals("image/png", sniffer.detect(TestDocuments.png()));
    }

    @Test
    void textIsNotADocument() {
        assertEquals("text/plain", sniffer.detect("Faktura VAT nr 1".getBytes(StandardCharsets.UTF_8)));
    }

    @ParameterizedTest
    @CsvSource({"faktura.pdf,application/pdf", "skan.jpg,image/jpeg", "skan.tif,image/tiff", "plik.xyz123,application/octet-stream"})
    void detectsFromName(String filename, String expected) {
        assertEquals(expected, sniffer.detectFromName(filename));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "image/jpg|image/jpeg",
            "IMAGE/PJPEG|image/jpeg",
            "application/pdf; charset=binary|application/pdf",
            "application/x-pdf|application/pdf",
            "image/png|image/png"
    })
    void normalizesAliases(String raw, String expected) {
        assertEquals(expected, MimeTypeSniffer.normalize(raw));
    }

    @Test
    void normalizeKeepsNull() {
        assertNull(MimeTypeSniffer.normalize(null));
    }
}
