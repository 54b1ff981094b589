package com.gillianbc.wealth.model.event;

import lombok.Getter;

/**
 * Permanent addition to monthly rental income from the event year onwards.
 */
@Getter
public final class RentalIncome extends FinancialEvent {

    private final double monthlyRental;

    public RentalIncome(String name, int year, double monthlyRental) {
        super(name, year);
        this.monthlyRental = requireFinite(monthlyRental, "monthlyRental");
    }

    @Override
    public EventType getType() {
        return EventType.RENTAL_INCOME;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
