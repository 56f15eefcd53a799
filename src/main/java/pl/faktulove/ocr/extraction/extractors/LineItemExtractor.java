package pl.faktulove.ocr.extraction.extractors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.LineItem;
import pl.faktulove.ocr.extraction.PolishNumbers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Item table segmenter. The table starts after a header line naming at least three
 * columns and ends at the first summary line. Rows are split on {@code |} or on runs of
 * two or more spaces; rows that do not split cleanly are read as a sequence of numbers.
 * The items are returned as a JSON array.
 */
@JBossLog
public class LineItemExtractor implements FieldExtractor {

    private static final List<String> HEADER_INDICATORS = List.of(
            "lp", "l.p.", "nazwa", "opis", "ilość", "ilosc", "j.m.", "jednostka",
            "cena", "wartość", "wartosc", "vat", "brutto", "netto");
    private static final List<String> SUMMARY_TERMS = List.of("suma", "razem", "łącznie", "do zapłaty", "podsumowanie");

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[,.]\\d+)?");
    private static final Pattern WORDS = Pattern.compile("[\\p{L}][\\p{L}\\s.\\-]*");
    private static final Pattern VAT = Pattern.compile("(\\d{1,2})\\s*%|\\bzw\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public LineItemExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "line-items";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        String[] lines = text.split("\n", -1);
        int[] offsets = lineOffsets(lines);

        int header = findHeader(lines);
        if (header < 0) return Map.of();

        List<LineItem> items = new ArrayList<>();
        int spanStart = -1;
        int spanEnd = -1;
        for (int i = header + 1; i < lines.length; i++) {
            String lower = lines[i].toLowerCase(Locale.ROOT);
            if (SUMMARY_TERMS.stream().anyMatch(lower::contains)) break;
            Optional<LineItem> item = parseRow(lines[i], items.size() + 1);
            if (item.isPresent()) {
                items.add(item.get());
                if (spanStart < 0) spanStart = offsets[i];
                spanEnd = offsets[i] + lines[i].length();
            }
        }
        if (items.isEmpty()) return Map.of();

        try {
            String json = objectMapper.writeValueAsString(items);
            return Map.of(InvoiceField.LINE_ITEMS, ExtractedValue.ofSpan(output, json, spanStart, spanEnd));
        } catch (JsonProcessingException e) {
            log.warnf("Could not serialize %d line items: %s", items.size(), e.getMessage());
            return Map.of();
        }
    }

    private static int[] lineOffsets(String[] lines) {
        int[] offsets = new int[lines.length];
        int offset = 0;
        for (int i = 0; i < lines.length; i++) {
            offsets[i] = offset;
            offset += lines[i].length() + 1;
        }
        return offsets;
    }

    private static int findHeader(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String lower = lines[i].toLowerCase(Locale.ROOT);
            long indicators = HEADER_INDICATORS.stream().filter(lower::contains).count();
            if (indicators >= 3) return i;
        }
        return -1;
    }

    Optional<LineItem> parseRow(String line, int lineNumber) {
        String trimmed = line.strip();
        if (trimmed.length() < 10) return Optional.empty();

        List<String> parts = trimmed.contains("|")
                ? Arrays.stream(trimmed.split("\\|")).map(String::strip).filter(p -> !p.isEmpty()).toList()
                : Arrays.stream(trimmed.split("\\s{2,}")).map(String::strip).filter(p -> !p.isEmpty()).toList();

        if (parts.size() >= 6) {
            Optional<LineItem> columns = parseColumns(parts, lineNumber);
            if (columns.isPresent()) return columns;
        }
        return parseNumbers(trimmed, lineNumber);
    }

    private Optional<LineItem> parseColumns(List<String> parts, int lineNumber) {
        int i = parts.get(0).chars().allMatch(Character::isDigit) ? 1 : 0;
        if (parts.size() < i + 6) return Optional.empty();
        Optional<BigDecimal> quantity = PolishNumbers.parse(parts.get(i + 1));
        Optional<BigDecimal> unitPrice = PolishNumbers.parse(parts.get(i + 3));
        Optional<BigDecimal> netValue = PolishNumbers.parse(parts.get(i + 5));
        if (quantity.isEmpty() || unitPrice.isEmpty() || netValue.isEmpty()) return Optional.empty();

        String vatRate = parts.get(i + 4).replace("%", "").strip().toLowerCase(Locale.ROOT);
        BigDecimal gross = parts.size() > i + 6
                ? PolishNumbers.parse(parts.get(i + 6)).orElse(null)
                : grossFromNet(netValue.get(), vatRate);
        return Optional.of(new LineItem(lineNumber, parts.get(i), quantity.get(), parts.get(i + 2),
                unitPrice.get(), vatRate, netValue.get(), gross));
    }

    private Optional<LineItem> parseNumbers(String line, int lineNumber) {
        String withoutRate = VAT.matcher(line).replaceAll(" ");
        List<BigDecimal> numbers = new ArrayList<>();
        Matcher m = NUMBER.matcher(withoutRate);
        while (m.find()) {
            PolishNumbers.parse(m.group()).ifPresent(numbers::add);
        }
        if (numbers.size() < 4) return Optional.empty();

        Matcher words = WORDS.matcher(line);
        String name = words.find() ? words.group().strip() : "Pozycja " + lineNumber;
        Matcher vat = VAT.matcher(line);
        String vatRate = vat.find() ? (vat.group(1) != null ? vat.group(1) : "zw") : null;

        int size = numbers.size();
        return Optional.of(new LineItem(lineNumber, name, numbers.get(size - 4), null, numbers.get(size - 3),
                vatRate, numbers.get(size - 2), numbers.get(size - 1)));
    }

    private static BigDecimal grossFromNet(BigDecimal net, String vatRate) {
        if (vatRate.chars().allMatch(Character::isDigit) && !vatRate.isEmpty()) {
            BigDecimal factor = BigDecimal.ONE.add(new BigDecimal(vatRate).movePointLeft(2));
            return net.multiply(factor).setScale(2, RoundingMode.HALF_UP);
        }
        return net;
    }
}
