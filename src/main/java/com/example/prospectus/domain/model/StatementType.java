package com.example.prospectus.domain.model;

/**
 * Financial statements a canonical line item can belong to.
 */
public enum StatementType {
    BALANCE_SHEET("balance_sheet"),
    PROFIT_AND_LOSS("profit_and_loss"),
    CASH_FLOW("cash_flow");

    private final String key;

    StatementType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
