package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VAT rate: a labelled percentage ("stawka VAT 23%", "8% VAT"), an exemption marker
 * ({@code zw}, {@code np}, {@code oo}) or, as a last resort, any small percentage.
 */
public class VatRateExtractor implements FieldExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(?:stawka(?:\\s+(?:vat|podatku))?|vat)\\s*[:]?\\s*(\\d{1,2})\\s*%", FLAGS),
            Pattern.compile("\\b(\\d{1,2})\\s*(?:%|proc\\.?)\\s*vat\\b", FLAGS),
            Pattern.compile("\\b(?:stawka(?:\\s+vat)?|vat)\\s*[:]?\\s*(zw|np|oo)\\b", FLAGS),
            Pattern.compile("\\b(zwolnion\\w*)\\s+z\\s+(?:podatku\\s+)?vat", FLAGS),
            Pattern.compile("\\b(\\d{1,2})\\s*%"));

    @Override
    public String name() {
        return "vat-rate";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                String raw = m.group(1).toLowerCase(Locale.ROOT);
                String value = raw.startsWith("zwolnion") ? "zw" : stripLeadingZero(raw);
                return Map.of(InvoiceField.VAT_RATE, ExtractedValue.ofSpan(output, value, m.start(1), m.end(1)));
            }
        }
        return Map.of();
    }

    private static String stripLeadingZero(String rate) {
        return rate.length() > 1 && rate.startsWith("0") ? rate.substring(1) : rate;
    }
}
