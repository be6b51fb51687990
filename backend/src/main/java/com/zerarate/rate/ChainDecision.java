package com.zerarate.rate;

import com.zerarate.rate.fallback.FallbackRateInfo;
import com.zerarate.rate.source.SourceOutcome;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of the resolution chain after live sources ran: a live rate, a fallback rate, or exhaustion.
 */
@Getter
public final class ChainDecision {

    public enum Kind {
        LIVE,
        FALLBACK,
        EXHAUSTED
    }

    private final Kind kind;
    private final SourceOutcome liveOutcome;
    private final FallbackRateInfo fallback;
    private final List<SourceOutcome> failures;

    private ChainDecision(Kind kind, SourceOutcome liveOutcome, FallbackRateInfo fallback, List<SourceOutcome> failures) {
        this.kind = kind;
        this.liveOutcome = liveOutcome;
        this.fallback = fallback;
        this.failures = List.copyOf(failures);
    }

    static ChainDecision live(SourceOutcome outcome, List<SourceOutcome> failures) {
        return new ChainDecision(Kind.LIVE, outcome, null, failures);
    }

    static ChainDecision fallback(FallbackRateInfo info, List<SourceOutcome> failures) {
        return new ChainDecision(Kind.FALLBACK, null, info, failures);
    }

    static ChainDecision exhausted(List<SourceOutcome> failures) {
        return new ChainDecision(Kind.EXHAUSTED, null, null, failures);
    }
}
