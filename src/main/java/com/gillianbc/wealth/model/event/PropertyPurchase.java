package com.gillianbc.wealth.model.event;

import lombok.Getter;

/**
 * Buying a property: the down payment leaves liquid wealth, the price joins property value, the new
 * loan joins the mortgage balance and its payment is added on top of any existing mortgage payment.
 */
@Getter
public final class PropertyPurchase extends FinancialEvent {

    private final double propertyPrice;
    private final double downPayment;
    private final double mortgageAmount;
    /** Monthly payment of the new loan, added to whatever is already being paid. */
    private final double newMortgagePayment;
    private final int mortgageTermYears;

    public PropertyPurchase(String name,
                            int year,
                            double propertyPrice,
                            double downPayment,
                            double mortgageAmount,
                            double newMortgagePayment,
                            int mortgageTermYears) {
        super(name, year);
        this.propertyPrice = requireNonNegative(propertyPrice, "propertyPrice");
        this.downPayment = requireNonNegative(downPayment, "downPayment");
        this.mortgageAmount = requireNonNegative(mortgageAmount, "mortgageAmount");
        this.newMortgagePayment = requireNonNegative(newMortgagePayment, "newMortgagePayment");
        if (mortgageTermYears < 0) {
            throw new IllegalArgumentException("mortgageTermYears must be >= 0");
        }
        this.mortgageTermYears = mortgageTermYears;
    }

    @Override
    public EventType getType() {
        return EventType.PROPERTY_PURCHASE;
    }

    @Override
    public <R> R accept(FinancialEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
