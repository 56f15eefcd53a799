package pl.faktulove.ocr.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PolishNumbersTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "1 234,56;1234.56",
            "1.234,56;1234.56",
            "1234.56;1234.56",
            "1845,00;1845.00",
            "12,5 zł;12.5",
            "99 PLN;99"
    })
    void parsesPolishNotation(String raw, String expected) {
        assertEquals(0, new BigDecimal(expected).compareTo(PolishNumbers.parse(raw).orElseThrow()));
    }

    @Test
    void rejectsNonNumbers() {
        assertTrue(PolishNumbers.parse("abc").isEmpty());
        assertTrue(PolishNumbers.parse("  ").isEmpty());
        assertTrue(PolishNumbers.parse(null).isEmpty());
    }

    @Test
    void plainFormHasTwoDecimals() {
        assertEquals("12.50", PolishNumbers.toPlain(new BigDecimal("12.5")));
        assertEquals("1845.00", PolishNumbers.toPlain(new BigDecimal("1845")));
        assertEquals("0.01", PolishNumbers.toPlain(new BigDecimal("0.005")));
    }
}
