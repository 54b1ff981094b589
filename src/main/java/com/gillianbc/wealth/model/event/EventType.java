package com.gillianbc.wealth.model.event;

import java.util.Arrays;

/**
 * Closed set of event kinds, keyed by the type string used on the wire and in saved scenarios.
 */
public enum EventType {
    PROPERTY_PURCHASE("property_purchase"),
    PROPERTY_SALE("property_sale"),
    ONE_TIME_EXPENSE("one_time_expense"),
    EXPENSE_CHANGE("expense_change"),
    RENTAL_INCOME("rental_income"),
    WINDFALL("windfall");

    private final String key;

    EventType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static EventType fromKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + key));
    }
}
