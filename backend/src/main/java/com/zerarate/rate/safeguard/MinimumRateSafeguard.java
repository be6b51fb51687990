package com.zerarate.rate.safeguard;

import com.zerarate.common.Amounts;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Network-enforced floor for fee evaluation. Applied to every rate the resolver returns,
 * whatever its provenance.
 */
@Slf4j
public class MinimumRateSafeguard {

    private volatile Map<String, BigDecimal> minimumRates;
    private volatile boolean enabled;

    public MinimumRateSafeguard(Map<String, BigDecimal> minimumRates, boolean enabled) {
        this.minimumRates = Amounts.requireRateTable(minimumRates, "Minimum rate");
        this.enabled = enabled;
    }

    /**
     * Returns the configured minimum when {@code rate} is below it and safeguards are on, else {@code rate}.
     */
    public BigDecimal enforce(BigDecimal rate, String instrumentId) {
        if (!enabled) {
            return rate;
        }
        BigDecimal minimum = minimumRates.get(instrumentId);
        if (minimum != null && rate.compareTo(minimum) < 0) {
            log.warn("Rate {} for {} below minimum {}, applying safeguard",
                    rate.toPlainString(), instrumentId, minimum.toPlainString());
            return minimum;
        }
        return rate;
    }

    Optional<BigDecimal> minimumFor(String instrumentId) {
        return Optional.ofNullable(minimumRates.get(instrumentId));
    }

    /**
     * Merges floors: same keys are overwritten, other keys kept.
     */
    public void merge(Map<String, BigDecimal> updates) {
        Map<String, BigDecimal> validated = Amounts.requireRateTable(updates, "Minimum rate");
        synchronized (this) {
            Map<String, BigDecimal> merged = new HashMap<>(minimumRates);
            merged.putAll(validated);
            minimumRates = Map.copyOf(merged);
        }
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
