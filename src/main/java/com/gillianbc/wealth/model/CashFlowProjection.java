package com.gillianbc.wealth.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The deterministic table together with its Year 1 breakdown.
 */
@Getter
public class CashFlowProjection {

    private final List<CashFlowRow> rows;
    private final Year1Breakdown year1Breakdown;

    public CashFlowProjection(List<CashFlowRow> rows, Year1Breakdown year1Breakdown) {
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
        this.year1Breakdown = Objects.requireNonNull(year1Breakdown, "year1Breakdown must not be null");
    }

    public List<Map<String, String>> render(CurrencyFormatter formatter) {
        List<Map<String, String>> table = new ArrayList<>(rows.size());
        for (CashFlowRow row : rows) {
            table.add(row.render(formatter));
        }
        return table;
    }

    public CashFlowRow row(int year) {
        return rows.stream()
                .filter(r -> r.getYear() == year)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no row for year " + year));
    }
}
