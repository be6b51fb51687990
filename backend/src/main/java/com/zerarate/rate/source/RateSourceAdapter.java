package com.zerarate.rate.source;

import com.zerarate.domain.RateSource;

/**
 * One live rate source in the resolution chain. Implementations report transport and parse
 * failures as {@link SourceOutcome#failed} rather than throwing.
 */
public interface RateSourceAdapter {

    /**
     * Provenance tag written to the cache when this source resolves a rate.
     */
    RateSource source();

    /**
     * Try to resolve the USD rate for one human unit of the instrument.
     */
    SourceOutcome tryResolve(String instrumentId);
}
