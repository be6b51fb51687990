package com.zerarate.rate;

import com.zerarate.rate.fallback.FallbackRateInfo;
import com.zerarate.rate.source.SourceOutcome;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Decision over ordered step outcomes: first resolved live outcome wins, then the fallback table,
 * otherwise the chain is exhausted. The fallback lookup runs only when no live outcome resolved.
 */
public final class RateResolutionChain {

    private RateResolutionChain() {}

    public static ChainDecision decide(List<SourceOutcome> liveOutcomes,
                                       Supplier<Optional<FallbackRateInfo>> fallbackLookup) {
        List<SourceOutcome> failures = liveOutcomes.stream()
                .takeWhile(o -> !o.isResolved())
                .toList();
        if (failures.size() < liveOutcomes.size()) {
            return ChainDecision.live(liveOutcomes.get(failures.size()), failures);
        }
        return fallbackLookup.get()
                .map(info -> ChainDecision.fallback(info, failures))
                .orElseGet(() -> ChainDecision.exhausted(failures));
    }

    /**
     * "indexer: HTTP 503; validator: no rate returned", or a note when no live source is configured.
     */
    public static String describeFailures(List<SourceOutcome> failures) {
        if (failures.isEmpty()) {
            return "no live rate sources configured";
        }
        return failures.stream().map(SourceOutcome::toString).collect(Collectors.joining("; "));
    }
}
