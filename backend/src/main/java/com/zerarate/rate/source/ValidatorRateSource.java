package com.zerarate.rate.source;

import com.zerarate.domain.RateSource;
import com.zerarate.rate.source.validator.TokenFeeInfo;
import com.zerarate.rate.source.validator.TokenFeeInfoRequest;
import com.zerarate.rate.source.validator.TokenFeeInfoResponse;
import com.zerarate.rate.source.validator.ValidatorFeeInfoClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the validator-authorized rate from a token fee-info query. Wire rates are fixed-point
 * with scale 10^18.
 */
@Slf4j
public class ValidatorRateSource implements RateSourceAdapter {

    public static final int WIRE_RATE_SCALE = 18;

    private final ValidatorFeeInfoClient client;
    private final Duration timeout;

    public ValidatorRateSource(ValidatorFeeInfoClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public RateSource source() {
        return RateSource.VALIDATOR;
    }

    @Override
    public SourceOutcome tryResolve(String instrumentId) {
        TokenFeeInfoResponse response;
        try {
            response = client.getTokenFeeInfo(TokenFeeInfoRequest.withRates(List.of(instrumentId)))
                    .block(timeout);
        } catch (RuntimeException e) {
            log.debug("Validator fee-info error for {}", instrumentId, e);
            return SourceOutcome.failed(RateSource.VALIDATOR, e.getMessage());
        }
        if (response == null || response.tokens() == null || response.tokens().isEmpty()) {
            return SourceOutcome.failed(RateSource.VALIDATOR, "no token fee info returned");
        }
        Optional<TokenFeeInfo> token = selectToken(response.tokens(), instrumentId);
        if (token.isEmpty() || token.get().rate() == null || token.get().rate().isBlank()) {
            return SourceOutcome.failed(RateSource.VALIDATOR, "no rate returned for " + instrumentId);
        }
        try {
            BigDecimal rate = fromWireRate(token.get().rate());
            if (rate.signum() < 0) {
                return SourceOutcome.failed(RateSource.VALIDATOR, "negative rate " + token.get().rate());
            }
            return SourceOutcome.resolved(rate, RateSource.VALIDATOR);
        } catch (NumberFormatException e) {
            return SourceOutcome.failed(RateSource.VALIDATOR, "malformed rate " + token.get().rate());
        }
    }

    /**
     * Converts a 10^18 fixed-point rate string into USD per human unit, exactly.
     */
    public static BigDecimal fromWireRate(String wireRate) {
        return new BigDecimal(wireRate.strip()).movePointLeft(WIRE_RATE_SCALE);
    }

    /**
     * The record for the requested identifier; the first record when the validator omits identifiers.
     */
    private static Optional<TokenFeeInfo> selectToken(List<TokenFeeInfo> tokens, String instrumentId) {
        Optional<TokenFeeInfo> exact = tokens.stream()
                .filter(t -> t != null && instrumentId.equals(t.contractId()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        TokenFeeInfo first = tokens.get(0);
        return first != null && (first.contractId() == null || first.contractId().isBlank())
                ? Optional.of(first)
                : Optional.empty();
    }
}
