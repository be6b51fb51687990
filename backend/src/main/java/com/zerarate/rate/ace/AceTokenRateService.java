package com.zerarate.rate.ace;

import com.zerarate.common.InstrumentIds;
import com.zerarate.rate.source.ValidatorRateSource;
import com.zerarate.rate.source.validator.AceToken;
import com.zerarate.rate.source.validator.AceTokensResponse;
import com.zerarate.rate.source.validator.ValidatorClientException;
import com.zerarate.rate.source.validator.ValidatorFeeInfoClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists the tokens the validator authorizes for fee payment (ACE tokens) with their rates converted
 * from the 10^18 wire scale. Reads the validator directly: no cache, fallback or safeguard applies.
 */
@Slf4j
public class AceTokenRateService {

    private final ValidatorFeeInfoClient client;
    private final Duration timeout;

    /**
     * @param client validator transport, or null when no validator is configured
     */
    public AceTokenRateService(ValidatorFeeInfoClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    /**
     * @throws ValidatorClientException when no validator is configured or the query fails
     */
    public List<AceTokenRate> listRates() {
        if (client == null) {
            throw new ValidatorClientException("Validator API not configured");
        }
        AceTokensResponse response;
        try {
            response = client.getAceTokens().block(timeout);
        } catch (RuntimeException e) {
            throw new ValidatorClientException("Failed to get ACE token rates from validator: " + e.getMessage(), e);
        }
        if (response == null || response.tokens() == null) {
            return List.of();
        }
        List<AceTokenRate> rates = new ArrayList<>();
        for (AceToken token : response.tokens()) {
            if (token == null || token.contractId() == null || token.rate() == null || token.rate().isBlank()) {
                continue;
            }
            try {
                rates.add(new AceTokenRate(token.contractId(), ValidatorRateSource.fromWireRate(token.rate())));
            } catch (NumberFormatException e) {
                log.warn("Skipping ACE token {} with malformed rate {}", token.contractId(), token.rate());
            }
        }
        return List.copyOf(rates);
    }

    /**
     * Rate of one authorized token; empty when the validator does not list it.
     *
     * @throws IllegalArgumentException for a blank identifier
     */
    public Optional<BigDecimal> findRate(String contractId) {
        String id = InstrumentIds.requireValid(contractId);
        return listRates().stream()
                .filter(t -> t.contractId().equals(id))
                .map(AceTokenRate::rate)
                .findFirst();
    }
}
