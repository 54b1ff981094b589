package com.gillianbc.wealth.model.event;

/**
 * One method per event kind. Every place that reacts to events implements this, so adding a kind
 * breaks the build until each of them handles it.
 *
 * @param <R> result of handling one event
 */
public interface FinancialEventVisitor<R> {

    R visit(PropertyPurchase event);

    R visit(PropertySale event);

    R visit(OneTimeExpense event);

    R visit(ExpenseChange event);

    R visit(RentalIncome event);

    R visit(Windfall event);
}
