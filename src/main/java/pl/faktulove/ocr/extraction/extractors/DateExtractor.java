package pl.faktulove.ocr.extraction.extractors;

import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ContextClassifier;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.FieldExtractor;
import pl.faktulove.ocr.extraction.InvoiceField;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Issue, sale and due dates. Dates are written {@code dd.MM.yyyy}, {@code yyyy-MM-dd} or
 * with a Polish month name ("15 marca 2024") and told apart by the label before them.
 * An unlabelled date is taken as the issue date when no labelled one exists.
 */
public class DateExtractor implements FieldExtractor {

    private static final Pattern DAY_FIRST = Pattern.compile("\\b(\\d{1,2})[./\\-](\\d{1,2})[./\\-](\\d{4})\\b");
    private static final Pattern YEAR_FIRST = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern MONTH_NAME = Pattern.compile(
            "\\b(\\d{1,2})\\s+(stycznia|lutego|marca|kwietnia|maja|czerwca|lipca|sierpnia|września|października|listopada|grudnia)\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final List<String> MONTHS = List.of("stycznia", "lutego", "marca", "kwietnia", "maja", "czerwca",
            "lipca", "sierpnia", "września", "października", "listopada", "grudnia");

    private static final ContextClassifier<InvoiceField> CLASSIFIER;

    static {
        Map<InvoiceField, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(InvoiceField.ISSUE_DATE, List.of("wystawienia", "wystawiono", "data faktury"));
        keywords.put(InvoiceField.SALE_DATE, List.of("sprzedaży", "sprzedano", "wykonania", "dostawy"));
        keywords.put(InvoiceField.DUE_DATE, List.of("płatności", "zapłaty", "termin"));
        CLASSIFIER = new ContextClassifier<>(keywords, 40);
    }

    private record DateMatch(LocalDate date, int start, int end) {
    }

    @Override
    public String name() {
        return "date";
    }

    @Override
    public Map<InvoiceField, ExtractedValue> extract(RecognitionOutput output) {
        String text = output.getRawText();
        List<DateMatch> matches = new ArrayList<>();
        collect(DAY_FIRST.matcher(text), 3, 2, 1, matches);
        collect(YEAR_FIRST.matcher(text), 1, 2, 3, matches);
        Matcher m = MONTH_NAME.matcher(text);
        while (m.find()) {
            int month = MONTHS.indexOf(m.group(2).toLowerCase(Locale.ROOT)) + 1;
            toDate(m.group(3), String.valueOf(month), m.group(1))
                    .ifPresent(d -> matches.add(new DateMatch(d, m.start(), m.end())));
        }
        matches.sort(Comparator.comparingInt(DateMatch::start));

        Map<InvoiceField, ExtractedValue> found = new EnumMap<>(InvoiceField.class);
        DateMatch firstUnlabelled = null;
        for (DateMatch match : matches) {
            Optional<InvoiceField> field = CLASSIFIER.classify(text, match.start());
            if (field.isPresent()) {
                found.putIfAbsent(field.get(), value(output, match));
            } else if (firstUnlabelled == null) {
                firstUnlabelled = match;
            }
        }
        if (!found.containsKey(InvoiceField.ISSUE_DATE) && firstUnlabelled != null) {
            found.put(InvoiceField.ISSUE_DATE, value(output, firstUnlabelled));
        }
        return found;
    }

    private static ExtractedValue value(RecognitionOutput output, DateMatch match) {
        return ExtractedValue.ofSpan(output, match.date().toString(), match.start(), match.end());
    }

    private static void collect(Matcher m, int yearGroup, int monthGroup, int dayGroup, List<DateMatch> into) {
        while (m.find()) {
            toDate(m.group(yearGroup), m.group(monthGroup), m.group(dayGroup))
                    .ifPresent(d -> into.add(new DateMatch(d, m.start(), m.end())));
        }
    }

    private static Optional<LocalDate> toDate(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
