package pl.faktulove.ocr.confidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.LineItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Consistency checks between fields of one invoice. Values are expected in the
 * normalized form {@link FieldRuleValidator} produces; a check whose inputs are missing
 * or unparsable is skipped.
 */
@JBossLog
@ApplicationScoped
public class CrossFieldRules {

    static final BigDecimal MIN_TOLERANCE = new BigDecimal("0.02");
    static final BigDecimal TOTALS_TOLERANCE_RATE = new BigDecimal("0.01");
    static final BigDecimal LINE_ITEMS_TOLERANCE_RATE = new BigDecimal("0.05");

    @Inject
    ObjectMapper objectMapper;

    /**
     * @param values normalized field values by field name
     */
    public List<FieldConflict> check(Map<String, String> values) {
        List<FieldConflict> conflicts = new ArrayList<>();
        Optional<BigDecimal> net = amount(values, InvoiceField.NET_AMOUNT);
        Optional<BigDecimal> vat = amount(values, InvoiceField.VAT_AMOUNT);
        Optional<BigDecimal> gross = amount(values, InvoiceField.GROSS_AMOUNT);

        if (net.isPresent() && vat.isPresent() && gross.isPresent()
                && !within(net.get().add(vat.get()), gross.get(), TOTALS_TOLERANCE_RATE)) {
            conflicts.add(new FieldConflict(
                    Set.of(InvoiceField.NET_AMOUNT.getFieldName(), InvoiceField.VAT_AMOUNT.getFieldName(),
                            InvoiceField.GROSS_AMOUNT.getFieldName()),
                    "Net amount plus VAT amount does not equal the gross amount"));
        }

        List<LineItem> items = lineItems(values.get(InvoiceField.LINE_ITEMS.getFieldName()));
        if (!items.isEmpty()) {
            BigDecimal itemsNet = sum(items.stream().map(LineItem::netValue).toList());
            if (net.isPresent() && itemsNet != null && !within(itemsNet, net.get(), LINE_ITEMS_TOLERANCE_RATE)) {
                conflicts.add(new FieldConflict(
                        Set.of(InvoiceField.NET_AMOUNT.getFieldName(), InvoiceField.LINE_ITEMS.getFieldName()),
                        "Net amount does not match the sum of line item net values"));
            }
            BigDecimal itemsGross = sum(items.stream().map(LineItem::grossValue).toList());
            if (gross.isPresent() && itemsGross != null && !within(itemsGross, gross.get(), LINE_ITEMS_TOLERANCE_RATE)) {
                conflicts.add(new FieldConflict(
                        Set.of(InvoiceField.GROSS_AMOUNT.getFieldName(), InvoiceField.LINE_ITEMS.getFieldName()),
                        "Gross amount does not match the sum of line item gross values"));
            }
        }

        Optional<LocalDate> issued = date(values, InvoiceField.ISSUE_DATE);
        Optional<LocalDate> due = date(values, InvoiceField.DUE_DATE);
        if (issued.isPresent() && due.isPresent() && due.get().isBefore(issued.get())) {
            conflicts.add(new FieldConflict(
                    Set.of(InvoiceField.ISSUE_DATE.getFieldName(), InvoiceField.DUE_DATE.getFieldName()),
                    "Due date is before the issue date"));
        }
        return conflicts;
    }

    private static boolean within(BigDecimal actual, BigDecimal expected, BigDecimal rate) {
        BigDecimal tolerance = expected.abs().multiply(rate).max(MIN_TOLERANCE);
        return actual.subtract(expected).abs().compareTo(tolerance) <= 0;
    }

    /**
     * Null when any item lacks the value.
     */
    private static BigDecimal sum(List<BigDecimal> parts) {
        if (parts.stream().anyMatch(Objects::isNull)) {
            return null;
        }
        return parts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static Optional<BigDecimal> amount(Map<String, String> values, InvoiceField field) {
        String value = values.get(field.getFieldName());
        if (value == null) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> date(Map<String, String> values, InvoiceField field) {
        String value = values.get(field.getFieldName());
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private List<LineItem> lineItems(String json) {
        if (json == null) return List.of();
        try {
            List<LineItem> items = objectMapper.readValue(json, new TypeReference<List<LineItem>>() {});
            if (items == null || items.contains(null)) return List.of();
            return items;
        } catch (JsonProcessingException e) {
            log.debugf("Line items not comparable with totals: %s", e.getOriginalMessage());
            return List.of();
        }
    }
}
