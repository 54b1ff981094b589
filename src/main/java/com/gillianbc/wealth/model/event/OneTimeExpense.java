package com.gillianbc.wealth.model.event;

import lombok.Getter;

@Getter
public final class OneTimeExpense extends FinancialEvent {

    private final double amount;

    public OneTimeExpense(String name, int year, double amount) {
        super(name, year);
        this.amount = requireNonNegative(amount, "amount");
    }

    @Override
    public EventType getType() {
        return EventType.ONE_TIME_EXPENSE;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
