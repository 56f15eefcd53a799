package pl.faktulove.ocr.confidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.LineItem;
import pl.faktulove.ocr.extraction.NipChecksum;
import pl.faktulove.ocr.extraction.PolishNumbers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural and business checks per invoice field. Used both to adjust engine
 * confidence and to validate manual corrections, so both paths accept exactly the same
 * values.
 */
@ApplicationScoped
public class FieldRuleValidator {

    public static final List<String> VAT_RATES = List.of("23", "8", "5", "0", "zw", "np", "oo");

    static final BigDecimal MIN_AMOUNT = new BigDecimal("0.01");
    static final BigDecimal MAX_AMOUNT = new BigDecimal("10000000");
    static final int MIN_YEAR = 1990;

    private static final Pattern INVOICE_NUMBER = Pattern.compile("^[A-Z0-9/\\-]{3,50}$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT));
    private static final Set<String> COMMON_CURRENCIES = Set.of("PLN", "EUR", "USD", "GBP", "CHF", "CZK");

    @Inject
    Clock clock;

    @Inject
    ObjectMapper objectMapper;

    public RuleCheck check(InvoiceField field, String value) {
        if (value == null || value.isBlank()) {
            return RuleCheck.fail(value, "Value must not be blank");
        }
        return switch (field.getType()) {
            case INVOICE_NUMBER -> checkInvoiceNumber(value);
            case DATE -> checkDate(value);
            case TAX_ID -> checkTaxId(value);
            case AMOUNT -> checkAmount(value);
            case VAT_RATE -> checkVatRate(value);
            case CURRENCY -> checkCurrency(value);
            case LINE_ITEMS -> checkLineItems(value);
            case BANK_ACCOUNT -> checkBankAccount(value);
        };
    }

    private RuleCheck checkInvoiceNumber(String value) {
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        if (!INVOICE_NUMBER.matcher(normalized).matches()) {
            return RuleCheck.fail(value, "Invoice number must be 3-50 characters of letters, digits, '/' or '-'");
        }
        return RuleCheck.pass(normalized);
    }

    private RuleCheck checkDate(String value) {
        Optional<LocalDate> date = parseDate(value.strip());
        if (date.isEmpty()) {
            return RuleCheck.fail(value, "Date must be written as yyyy-MM-dd or dd.MM.yyyy");
        }
        int maxYear = LocalDate.now(clock).getYear() + 2;
        int year = date.get().getYear();
        if (year < MIN_YEAR || year > maxYear) {
            return RuleCheck.fail(value, "Date must fall between " + MIN_YEAR + " and " + maxYear);
        }
        return RuleCheck.pass(date.get().toString());
    }

    private static Optional<LocalDate> parseDate(String value) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    private RuleCheck checkTaxId(String value) {
        String nip = NipChecksum.normalize(value);
        if (!NipChecksum.isValid(nip)) {
            return RuleCheck.fail(value, "Tax ID must be 10 digits with a valid NIP checksum");
        }
        return RuleCheck.pass(nip);
    }

    private RuleCheck checkAmount(String value) {
        Optional<BigDecimal> amount = PolishNumbers.parse(value);
        if (amount.isEmpty()) {
            return RuleCheck.fail(value, "Amount is not a number");
        }
        if (amount.get().compareTo(MIN_AMOUNT) < 0 || amount.get().compareTo(MAX_AMOUNT) > 0) {
            return RuleCheck.fail(value, "Amount must be between 0.01 and 10000000");
        }
        return RuleCheck.pass(PolishNumbers.toPlain(amount.get()));
    }

    private RuleCheck checkVatRate(String value) {
        String normalized = value.replace("%", "").strip().toLowerCase(Locale.ROOT);
        if (normalized.matches("\\d+[.,]0+")) {
            normalized = normalized.substring(0, normalized.indexOf(normalized.contains(",") ? ',' : '.'));
        }
        if (!VAT_RATES.contains(normalized)) {
            return RuleCheck.fail(value, "VAT rate must be one of " + String.join(", ", VAT_RATES));
        }
        return RuleCheck.pass(normalized);
    }

    private RuleCheck checkCurrency(String value) {
        String code = value.strip().toUpperCase(Locale.ROOT);
        if (code.equals("ZŁ") || code.equals("ZL")) {
            code = "PLN";
        }
        if (COMMON_CURRENCIES.contains(code)) {
            return RuleCheck.pass(code);
        }
        try {
            return RuleCheck.pass(Currency.getInstance(code).getCurrencyCode());
        } catch (IllegalArgumentException e) {
            return RuleCheck.fail(value, "Currency must be an ISO 4217 code");
        }
    }

    private RuleCheck checkBankAccount(String value) {
        String iban = value.replaceAll("\\s", "").toUpperCase(Locale.ROOT);
        if (iban.matches("\\d{26}")) {
            iban = "PL" + iban;
        }
        if (!iban.matches("[A-Z]{2}\\d{2}[A-Z0-9]{10,30}") || (iban.startsWith("PL") && iban.length() != 28)) {
            return RuleCheck.fail(value, "Bank account must be an IBAN");
        }
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        StringBuilder digits = new StringBuilder();
        for (char c : rearranged.toCharArray()) {
            digits.append(Character.isLetter(c) ? String.valueOf(c - 'A' + 10) : String.valueOf(c));
        }
        if (!new BigInteger(digits.toString()).mod(BigInteger.valueOf(97)).equals(BigInteger.ONE)) {
            return RuleCheck.fail(value, "Bank account checksum is invalid");
        }
        return RuleCheck.pass(iban);
    }

    private RuleCheck checkLineItems(String value) {
        List<LineItem> items;
        try {
            items = objectMapper.readValue(value, new TypeReference<List<LineItem>>() {});
        } catch (JsonProcessingException e) {
            return RuleCheck.fail(value, "Line items must be a JSON array of items");
        }
        if (items == null || items.isEmpty()) {
            return RuleCheck.fail(value, "Line items must not be empty");
        }
        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            if (item == null) {
                return RuleCheck.fail(value, "Line item at position " + (i + 1) + " is empty");
            }
            if (item.quantity() == null || item.unitNetPrice() == null || item.netValue() == null
                    || item.quantity().signum() <= 0 || item.netValue().signum() <= 0) {
                return RuleCheck.fail(value, "Line item " + item.lineNumber() + " lacks quantity, price or value");
            }
            if (item.unitNetPrice().signum() < 0) {
                return RuleCheck.fail(value, "Line item " + item.lineNumber() + " has a negative unit price");
            }
            BigDecimal expected = item.quantity().multiply(item.unitNetPrice());
            BigDecimal tolerance = item.netValue().abs().movePointLeft(2).max(new BigDecimal("0.02"));
            if (expected.subtract(item.netValue()).abs().compareTo(tolerance) > 0) {
                return RuleCheck.fail(value, "Line item " + item.lineNumber() + ": quantity x price does not match net value");
            }
        }
        try {
            return RuleCheck.pass(objectMapper.writeValueAsString(items));
        } catch (JsonProcessingException e) {
            return RuleCheck.fail(value, "Line items could not be normalized");
        }
    }
}
