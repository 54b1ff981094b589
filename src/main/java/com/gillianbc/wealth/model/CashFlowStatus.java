package com.gillianbc.wealth.model;

public enum CashFlowStatus {
    DEFICIT,
    SURPLUS;

    public static CashFlowStatus of(double available) {
        return available < 0 ? DEFICIT : SURPLUS;
    }
}
