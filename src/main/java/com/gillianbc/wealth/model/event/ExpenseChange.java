package com.gillianbc.wealth.model.event;

import lombok.Getter;

/**
 * Permanent change to monthly living expenses from the event year onwards. Negative values reduce
 * expenses (e.g. children leaving home).
 */
@Getter
public final class ExpenseChange extends FinancialEvent {

    private final double monthlyChange;

    public ExpenseChange(String name, int year, double monthlyChange) {
        super(name, year);
        this.monthlyChange = requireFinite(monthlyChange, "monthlyChange");
    }

    @Override
    public EventType getType() {
        return EventType.EXPENSE_CHANGE;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
