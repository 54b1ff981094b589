package com.gillianbc.wealth.model.event;

import lombok.Getter;

/**
 * Selling the household's property. Net proceeds go to liquid wealth and the payoff is taken off the
 * mortgage balance.
 */
@Getter
public final class PropertySale extends FinancialEvent {

    private final double salePrice;
    private final double mortgagePayoff;
    private final double sellingCosts;

    public PropertySale(String name, int year, double salePrice, double mortgagePayoff, double sellingCosts) {
        super(name, year);
        this.salePrice = requireNonNegative(salePrice, "salePrice");
        this.mortgagePayoff = requireNonNegative(mortgagePayoff, "mortgagePayoff");
        this.sellingCosts = requireNonNegative(sellingCosts, "sellingCosts");
    }

    public double netProceeds() {
        return salePrice - mortgagePayoff - sellingCosts;
    }

    @Override
    public EventType getType() {
        return EventType.PROPERTY_SALE;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
