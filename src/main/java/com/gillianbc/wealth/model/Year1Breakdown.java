package com.gillianbc.wealth.model;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line-by-line walk from gross income to the amount left for investment in the first year.
 */
@Getter
public class Year1Breakdown {

    private final List<LineItem> items;
    private final double available;
    private final CashFlowStatus status;

    public Year1Breakdown(List<LineItem> items, double available) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
        this.available = available;
        this.status = CashFlowStatus.of(available);
    }

    public Map<String, String> render(CurrencyFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter must not be null");
        Map<String, String> lines = new LinkedHashMap<>();
        for (LineItem item : items) {
            lines.put(item.getLabel(), formatter.format(item.getAmount()));
        }
        return lines;
    }
}
