package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ContextClassifier;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.NipChecksum;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seller and buyer NIP. Only labelled numbers ("NIP: 526-104-08-28", "VAT UE: PL5261040828")
 * are considered, so bank account and phone digits are not mistaken for tax IDs. The
 * party is read from the nearest preceding "Sprzedawca"/"Nabywca" label; unlabelled IDs
 * fill seller first, then buyer. A checksum-valid candidate beats an invalid one.
 */
public class TaxIdExtractor implements FieldExtractor {

    private static final Pattern LABELLED_NIP = Pattern.compile(
            "(?iu:\\bNIP|\\bVAT(?:[\\s\\-]?(?:UE|EU))?|\\bnr\\s+VAT|\\bidentyfikator\\s+podatkowy)\\s*[:.]?\\s*(?:PL\\s?)?"
                    + "(\\d{3}[\\s\\-]?\\d{3}[\\s\\-]?\\d{2}[\\s\\-]?\\d{2}|\\d{3}[\\s\\-]?\\d{2}[\\s\\-]?\\d{2}[\\s\\-]?\\d{3})(?!\\d)");

    private static final ContextClassifier<InvoiceField> CLASSIFIER;

    static {
        Map<InvoiceField, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(InvoiceField.SELLER_TAX_ID, List.of("sprzedawca", "wystawca", "dostawca"));
        keywords.put(InvoiceField.BUYER_TAX_ID, List.of("nabywca", "odbiorca", "kupujący"));
        CLASSIFIER = new ContextClassifier<>(keywords, 200);
    }

    private record Candidate(String nip, boolean valid, int start, int end, InvoiceField party) {
    }

    @Override
    public String name() {
        return "tax-id";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        List<Candidate> labelled = new ArrayList<>();
        List<Candidate> unlabelled = new ArrayList<>();
        Matcher m = LABELLED_NIP.matcher(text);
        while (m.find()) {
            String nip = NipChecksum.normalize(m.group(1));
            Optional<InvoiceField> party = CLASSIFIER.classify(text, m.start());
            Candidate candidate = new Candidate(nip, NipChecksum.isValid(nip), m.start(1), m.end(1), party.orElse(null));
            (party.isPresent() ? labelled : unlabelled).add(candidate);
        }

        Map<InvoiceField, ExtractedValue> found = new EnumMap<>(InvoiceField.class);
        for (InvoiceField party : List.of(InvoiceField.SELLER_TAX_ID, InvoiceField.BUYER_TAX_ID)) {
            labelled.stream()
                    .filter(c -> c.party() == party)
                    .min(Comparator.comparing((Candidate c) -> !c.valid()).thenComparingInt(Candidate::start))
                    .ifPresent(c -> found.put(party, ExtractedValue.ofSpan(output, c.nip(), c.start(), c.end())));
        }
        for (Candidate c : unlabelled) {
            if (found.values().stream().anyMatch(v -> v.value().equals(c.nip()))) continue;
            InvoiceField party = !found.containsKey(InvoiceField.SELLER_TAX_ID)
                    ? InvoiceField.SELLER_TAX_ID
                    : InvoiceField.BUYER_TAX_ID;
            found.putIfAbsent(party, ExtractedValue.ofSpan(output, c.nip(), c.start(), c.end()));
        }
        return found;
    }
}
