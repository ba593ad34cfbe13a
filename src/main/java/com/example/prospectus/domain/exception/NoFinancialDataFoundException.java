package com.example.prospectus.domain.exception;

/**
 * Raised when not a single canonical financial line item is recognised in the document,
 * which usually means the upload is not a financial prospectus.
 */
public class NoFinancialDataFoundException extends DomainException {

    private final int pagesWithText;

    /**
     * @param pagesScanned  number of pages inspected
     * @param pagesWithText number of inspected pages that carried a text layer
     */
    public NoFinancialDataFoundException(int pagesScanned, int pagesWithText) {
        super(pagesWithText == 0
                ? "The document has no extractable text layer."
                : "No financial statement line items were recognised in " + pagesScanned + " pages.");
        this.pagesWithText = pagesWithText;
    }

    public int getPagesWithText() {
        return pagesWithText;
    }
}
