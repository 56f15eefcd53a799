package pl.faktulove.ocr.extraction;

public enum FieldType {
    INVOICE_NUMBER,
    DATE,
    TAX_ID,
    AMOUNT,
    VAT_RATE,
    CURRENCY,
    LINE_ITEMS,
    BANK_ACCOUNT
}
