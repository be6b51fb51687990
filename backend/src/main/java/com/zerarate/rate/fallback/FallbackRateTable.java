package com.zerarate.rate.fallback;

import com.zerarate.common.Amounts;
import com.zerarate.common.InstrumentIds;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-configured static rates used only when every live source fails.
 * Lookup order: exact identifier, then symbol family ({@code $ZRA+0042} -> {@code $ZRA+0000}).
 */
public class FallbackRateTable {

    private volatile Map<String, BigDecimal> rates;

    public FallbackRateTable(Map<String, BigDecimal> initialRates) {
        this.rates = Amounts.requireRateTable(initialRates, "Fallback rate");
    }

    public Optional<FallbackRateInfo> lookup(String instrumentId) {
        if (instrumentId == null) {
            return Optional.empty();
        }
        Map<String, BigDecimal> current = rates;
        BigDecimal exact = current.get(instrumentId);
        if (exact != null) {
            return Optional.of(new FallbackRateInfo(exact, FallbackMatchType.EXACT_MATCH, instrumentId));
        }
        return InstrumentIds.symbolFamilyKey(instrumentId)
                .flatMap(key -> Optional.ofNullable(current.get(key))
                        .map(rate -> new FallbackRateInfo(rate, FallbackMatchType.SYMBOL_MATCH, key)));
    }

    /**
     * Merges entries: same keys are overwritten, other keys kept.
     */
    public void merge(Map<String, BigDecimal> updates) {
        Map<String, BigDecimal> validated = Amounts.requireRateTable(updates, "Fallback rate");
        synchronized (this) {
            Map<String, BigDecimal> merged = new HashMap<>(rates);
            merged.putAll(validated);
            rates = Map.copyOf(merged);
        }
    }

    Map<String, BigDecimal> asMap() {
        return rates;
    }
}
