package pl.faktulove.ocr.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Parsing of amounts written the Polish way: {@code 1 234,56}, {@code 1.234,56}, {@code 1234.56}.
 */
public final class PolishNumbers {

    private PolishNumbers() {
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.replaceAll("[\\s\\u00A0]", "")
                .replaceAll("(?i)(zł|pln|złotych)$", "");
        if (s.isEmpty()) return Optional.empty();
        if (s.contains(",")) {
            s = s.replace(".", "").replace(',', '.');
        }
        try {
            return Optional.of(new BigDecimal(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static String toPlain(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
