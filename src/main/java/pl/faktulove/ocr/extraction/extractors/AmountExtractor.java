package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.PolishNumbers;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Net, VAT and gross totals, read from the amount that directly follows a label.
 * For the gross amount "do zapłaty" beats "brutto", which beats "razem"/"suma".
 */
public class AmountExtractor implements FieldExtractor {

    private static final String AMOUNT =
            "(\\d{1,3}(?:[ \\u00A0.]\\d{3})+(?:,\\d{1,2})?|\\d+(?:[,.]\\d{1,2})?)(?![\\d%/\\-]|[,.]\\d|\\s*%)";

    private static final BigDecimal MAX_AMOUNT = new BigDecimal("10000000");

    private record Label(InvoiceField field, Pattern pattern) {
        Label(InvoiceField field, String words) {
            this(field, Pattern.compile("(?iu:" + words + ")[ \\t]*[:=|]?[ \\t]*(?:PLN[ \\t]*)?" + AMOUNT));
        }
    }

    private static final List<Label> LABELS = List.of(
            new Label(InvoiceField.GROSS_AMOUNT, "\\bdo\\s+zapłaty"),
            new Label(InvoiceField.GROSS_AMOUNT, "\\b(?:wartość\\s+|kwota\\s+)?brutto"),
            new Label(InvoiceField.GROSS_AMOUNT, "\\b(?:razem|suma|łącznie|ogółem)"),
            new Label(InvoiceField.NET_AMOUNT, "\\b(?:wartość\\s+|kwota\\s+)?netto"),
            new Label(InvoiceField.VAT_AMOUNT, "\\b(?:kwota\\s+vat|kwota\\s+podatku|podatek\\s+vat|vat)"));

    @Override
    public String name() {
        return "amount";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        Map<InvoiceField, ExtractedValue> found = new EnumMap<>(InvoiceField.class);
        for (Label label : LABELS) {
            if (found.containsKey(label.field())) continue;
            Matcher m = label.pattern().matcher(text);
            while (m.find()) {
                Optional<BigDecimal> amount = PolishNumbers.parse(m.group(1));
                if (amount.isPresent() && amount.get().signum() > 0 && amount.get().compareTo(MAX_AMOUNT) <= 0) {
                    found.put(label.field(), ExtractedValue.ofSpan(output,
                            PolishNumbers.toPlain(amount.get()), m.start(1), m.end(1)));
                    break;
                }
            }
        }
        return found;
    }
}
