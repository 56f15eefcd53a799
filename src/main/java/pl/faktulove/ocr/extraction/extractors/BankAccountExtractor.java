package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Polish bank account number, 26 digits with or without the {@code PL} prefix and
 * grouping spaces. Returned as an IBAN without spaces.
 */
public class BankAccountExtractor implements FieldExtractor {

    private static final Pattern ACCOUNT = Pattern.compile("(?<![\\dA-Z])(?:PL\\s?)?(\\d{2}(?:\\s?\\d{4}){6})(?!\\d)");

    @Override
    public String name() {
        return "bank-account";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        Matcher m = ACCOUNT.matcher(output.getRawText());
        if (!m.find()) {
            return Map.of();
        }
        String iban = "PL" + m.group(1).replaceAll("\\s", "");
        return Map.of(InvoiceField.BANK_ACCOUNT, ExtractedValue.ofSpan(output, iban, m.start(), m.end()));
    }
}
