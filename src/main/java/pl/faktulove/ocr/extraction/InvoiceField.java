package pl.faktulove.ocr.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The invoice fields the pipeline extracts. Required fields decide the aggregate
 * confidence of a result.
 */
public enum InvoiceField {
    INVOICE_NUMBER("invoice_number", true, FieldType.INVOICE_NUMBER),
    ISSUE_DATE("issue_date", true, FieldType.DATE),
    SALE_DATE("sale_date", false, FieldType.DATE),
    DUE_DATE("due_date", false, FieldType.DATE),
    SELLER_TAX_ID("seller_tax_id", true, FieldType.TAX_ID),
    BUYER_TAX_ID("buyer_tax_id", true, FieldType.TAX_ID),
    NET_AMOUNT("net_amount", false, FieldType.AMOUNT),
    VAT_AMOUNT("vat_amount", false, FieldType.AMOUNT),
    GROSS_AMOUNT("gross_amount", true, FieldType.AMOUNT),
    VAT_RATE("vat_rate", true, FieldType.VAT_RATE),
    CURRENCY("currency", false, FieldType.CURRENCY),
    LINE_ITEMS("line_items", false, FieldType.LINE_ITEMS),
    BANK_ACCOUNT("bank_account", false, FieldType.BANK_ACCOUNT);

    private final String fieldName;
    private final boolean required;
    private final FieldType type;

    InvoiceField(String fieldName, boolean required, FieldType type) {
        this.fieldName = fieldName;
        this.required = required;
        this.type = type;
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isRequired() {
        return required;
    }

    public FieldType getType() {
        return type;
    }

    public static Optional<InvoiceField> fromName(String fieldName) {
        return Arrays.stream(values()).filter(f -> f.fieldName.equals(fieldName)).findFirst();
    }

    public static List<InvoiceField> requiredFields() {
        return Arrays.stream(values()).filter(InvoiceField::isRequired).toList();
    }
}
