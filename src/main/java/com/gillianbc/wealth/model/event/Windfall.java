package com.gillianbc.wealth.model.event;

import lombok.Getter;

@Getter
public final class Windfall extends FinancialEvent {

    private final double amount;

    public Windfall(String name, int year, double amount) {
        super(name, year);
        this.amount = requireNonNegative(amount, "amount");
    }

    @Override
    public EventType getType() {
        return EventType.WINDFALL;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
