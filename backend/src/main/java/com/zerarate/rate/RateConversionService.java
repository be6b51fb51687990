package com.zerarate.rate;

import com.zerarate.common.Amounts;
import com.zerarate.common.InstrumentIds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * USD ↔ instrument conversion on top of one {@link RateResolver#resolve} call per operation.
 */
@Component
@RequiredArgsConstructor
public class RateConversionService {

    /** Precision used only when a quotient has no terminating decimal expansion. */
    static final MathContext NON_TERMINATING_PRECISION = MathContext.DECIMAL128;

    private final RateResolver rateResolver;

    /**
     * instrumentAmount = usdAmount / rate.
     *
     * @throws ArithmeticException when the resolved rate is zero
     */
    public BigDecimal usdToInstrument(BigDecimal usdAmount, String instrumentId) {
        Amounts.requireNonNegative(usdAmount, "USD amount");
        String id = InstrumentIds.requireValid(instrumentId);
        BigDecimal rate = rateResolver.resolve(id);
        if (rate.signum() == 0) {
            throw new ArithmeticException("Division by zero: resolved rate for " + id + " is zero");
        }
        return divide(usdAmount, rate);
    }

    public BigDecimal usdToInstrument(String usdAmount, String instrumentId) {
        return usdToInstrument(Amounts.parseNonNegative(usdAmount, "USD amount"), instrumentId);
    }

    public BigDecimal usdToInstrument(Number usdAmount, String instrumentId) {
        return usdToInstrument(Amounts.parseNonNegative(usdAmount, "USD amount"), instrumentId);
    }

    /**
     * usdAmount = amount * rate.
     */
    public BigDecimal instrumentToUsd(BigDecimal amount, String instrumentId) {
        Amounts.requireNonNegative(amount, "Amount");
        String id = InstrumentIds.requireValid(instrumentId);
        return withoutExponent(amount.multiply(rateResolver.resolve(id)));
    }

    public BigDecimal instrumentToUsd(String amount, String instrumentId) {
        return instrumentToUsd(Amounts.parseNonNegative(amount, "Amount"), instrumentId);
    }

    public BigDecimal instrumentToUsd(Number amount, String instrumentId) {
        return instrumentToUsd(Amounts.parseNonNegative(amount, "Amount"), instrumentId);
    }

    static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        BigDecimal quotient;
        try {
            quotient = dividend.divide(divisor);
        } catch (ArithmeticException nonTerminating) {
            quotient = dividend.divide(divisor, NON_TERMINATING_PRECISION);
        }
        return withoutExponent(quotient);
    }

    /**
     * Exact division keeps the preferred scale, which can be negative (5 / 0.10 is 5E+1); results
     * are returned with scale zero or more.
     */
    static BigDecimal withoutExponent(BigDecimal value) {
        return value.scale() < 0 ? value.setScale(0) : value;
    }
}
