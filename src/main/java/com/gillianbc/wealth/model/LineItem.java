package com.gillianbc.wealth.model;

import lombok.Value;

/**
 * A labelled amount in the Year 1 breakdown. Labels carry their sign prefix ("- Tax", "= Take Home") and
 * deducted lines hold the positive amount deducted. Result lines ("= ...") hold the signed result, so
 * "= Available for Investment" is negative in a deficit.
 */
@Value
public class LineItem {
    String label;
    double amount;
}
