package com.gillianbc.wealth.service;

import com.gillianbc.wealth.model.event.PropertyPurchase;
import org.springframework.stereotype.Service;

/**
 * Level-payment mortgage arithmetic.
 */
@Service
public class MortgageAmortizer {

    /** Balances below half a cent are treated as repaid. */
    public static final double SETTLED_THRESHOLD = 0.005;

    /**
     * Standard annuity payment:
     * payment = P * r(1+r)^n / ((1+r)^n - 1), with r the monthly rate and n the number of months.
     * <p>
     * A zero rate gives {@code principal / termMonths}. A non-positive term or principal gives 0, since
     * there is nothing that can be amortized.
     *
     * @param principal  amount borrowed
     * @param annualRate nominal annual rate as a decimal (0.035 = 3.5%)
     * @param termMonths number of monthly payments
     * @return monthly payment
     */
    public double monthlyPayment(double principal, double annualRate, int termMonths) {
        if (termMonths <= 0 || principal <= 0) {
            return 0.0;
        }
        if (annualRate == 0) {
            return principal / termMonths;
        }
        double monthlyRate = annualRate / 12;
        double growth = Math.pow(1 + monthlyRate, termMonths);
        return principal * (monthlyRate * growth) / (growth - 1);
    }

    public double monthlyPaymentForYears(double principal, double annualRate, int termYears) {
        return monthlyPayment(principal, annualRate, termYears * 12);
    }

    /**
     * Purchase financed by a level-payment mortgage over the remainder of the price.
     */
    public PropertyPurchase financedPurchase(String name,
                                             int year,
                                             double propertyPrice,
                                             double downPayment,
                                             double annualRate,
                                             int termYears) {
        if (downPayment > propertyPrice) {
            throw new IllegalArgumentException("downPayment must not exceed propertyPrice");
        }
        double loan = propertyPrice - downPayment;
        double payment = monthlyPaymentForYears(loan, annualRate, termYears);
        return new PropertyPurchase(name, year, propertyPrice, downPayment, loan, payment, termYears);
    }

    /**
     * One amortization period: interest accrues on the opening balance, whatever the payment leaves
     * after interest reduces the balance. Underpayment never grows the balance, and the balance never
     * goes below zero.
     *
     * @param balance    opening balance
     * @param payment    payment made over the period
     * @param periodRate interest rate for the period (annual rate for annual steps, annual/12 for monthly)
     */
    public AmortizationStep amortize(double balance, double payment, double periodRate) {
        if (isSettled(balance)) {
            return new AmortizationStep(0.0, 0.0, 0.0);
        }
        double interest = balance * periodRate;
        double principalPaid = Math.max(payment - interest, 0.0);
        double closing = Math.max(balance - principalPaid, 0.0);
        return new AmortizationStep(interest, principalPaid, closing);
    }

    public boolean isSettled(double balance) {
        return Math.abs(balance) < SETTLED_THRESHOLD;
    }

    /** Split of one period's payment. */
    public static final class AmortizationStep {
        public final double interest;
        public final double principalPaid;
        public final double closingBalance;

        public AmortizationStep(double interest, double principalPaid, double closingBalance) {
            this.interest = interest;
            this.principalPaid = principalPaid;
            this.closingBalance = closingBalance;
        }
    }
}
