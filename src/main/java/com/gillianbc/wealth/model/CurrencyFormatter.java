package com.gillianbc.wealth.model;

import java.util.Locale;

/**
 * Turns an amount in the unit of account into display text. Supplied by the caller, which owns
 * currency conversion and locale; the engine only ever passes plain numbers through it.
 */
@FunctionalInterface
public interface CurrencyFormatter {

    String format(double amount);

    /**
     * Whole units with thousands separators and no symbol, e.g. {@code -12,346}.
     */
    static CurrencyFormatter plain() {
        return amount -> String.format(Locale.ROOT, "%,.0f", amount);
    }

    static CurrencyFormatter withSymbol(String symbol) {
        return amount -> amount < 0
                ? "-" + symbol + String.format(Locale.ROOT, "%,.0f", -amount)
                : symbol + String.format(Locale.ROOT, "%,.0f", amount);
    }
}
