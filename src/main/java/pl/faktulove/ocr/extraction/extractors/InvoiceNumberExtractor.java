package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Invoice number: a labelled number ("Faktura VAT nr FV/2024/03/001") or, failing that,
 * the first unlabelled number shaped like {@code FV/12/2024}.
 */
public class InvoiceNumberExtractor implements FieldExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(?iu:nr\\s+faktury|numer\\s+faktury|faktura(?:\\s+vat)?\\s+nr\\.?|faktura(?:\\s+vat)?|fv|nr\\.?)"
                    + "\\s*[:#]?\\s*([A-Z0-9]+(?:[/\\-][A-Z0-9]+)+|[A-Z]*\\d+)"),
            Pattern.compile("\\b([A-Z]{1,4}[/\\-]\\d+[/\\-]\\d{2,4}(?:[/\\-]\\d+)?)\\b"));

    @Override
    public String name() {
        return "invoice-number";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String candidate = m.group(1);
                if (candidate.length() < 3 || !candidate.chars().anyMatch(Character::isDigit)) continue;
                return Map.of(InvoiceField.INVOICE_NUMBER,
                        ExtractedValue.ofSpan(output, candidate, m.start(1), m.end(1)));
            }
        }
        return Map.of();
    }
}
