package com.zerarate.rate.source;

import com.zerarate.domain.RateSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one chain step: a resolved rate with its source, or a failure with a reason.
 */
@Getter
public final class SourceOutcome {

    private final RateSource source;
    private final BigDecimal rate;
    private final String failureReason;

    private SourceOutcome(RateSource source, BigDecimal rate, String failureReason) {
        this.source = source;
        this.rate = rate;
        this.failureReason = failureReason;
    }

    public static SourceOutcome resolved(BigDecimal rate, RateSource source) {
        Objects.requireNonNull(rate, "rate");
        Objects.requireNonNull(source, "source");
        return new SourceOutcome(source, rate, null);
    }

    public static SourceOutcome failed(RateSource source, String reason) {
        Objects.requireNonNull(source, "source");
        return new SourceOutcome(source, null, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public boolean isResolved() {
        return rate != null;
    }

    public Optional<BigDecimal> getRate() {
        return Optional.ofNullable(rate);
    }

    @Override
    public String toString() {
        return isResolved()
                ? source.tag() + "=" + rate.toPlainString()
                : source.tag() + ": " + failureReason;
    }
}
