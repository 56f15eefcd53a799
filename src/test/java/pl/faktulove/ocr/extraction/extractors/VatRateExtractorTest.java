package pl.faktulove.ocr.extraction.extractors;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.InvoiceField;

import static org.junit.jupiter.api.Assertions.*;

class VatRateExtractorTest {

    private final VatRateExtractor extractor = new VatRateExtractor();

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "Stawka VAT: 23%;23",
            "8% VAT;8",
            "stawka zw;zw",
            "Sprzedaż zwolniona z podatku VAT;zw",
            "Pozycja 05 % rabat;5"
    })
    void readsRate(String text, String expected) {
        var found = extractor.extract(RecognitionOutput.withUniformConfidence(text, 90));

        assertEquals(expected, found.get(InvoiceField.VAT_RATE).value());
    }

    @Test
    void nothingWithoutPercentOrMarker() {
        assertTrue(extractor.extract(RecognitionOutput.withUniformConfidence("Faktura nr 12", 90)).isEmpty());
    }
}
