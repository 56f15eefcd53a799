package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CurrencyExtractor implements FieldExtractor {

    private static final Pattern CURRENCY = Pattern.compile("\\b(PLN|EUR|USD|GBP|CHF|CZK)\\b|(zł)(?!\\p{L})");

    @Override
    public String name() {
        return "currency";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        Matcher m = CURRENCY.matcher(output.getRawText());
        if (!m.find()) {
            return Map.of();
        }
        String code = m.group(1) != null ? m.group(1) : "PLN";
        return Map.of(InvoiceField.CURRENCY, ExtractedValue.ofSpan(output, code, m.start(), m.end()));
    }
}
