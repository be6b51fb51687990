package com.zerarate.rate;

import lombok.Getter;

/**
 * No live source produced a rate and no fallback entry exists for the instrument.
 */
@Getter
public class RateResolutionException extends RuntimeException {

    private final String instrumentId;

    public RateResolutionException(String instrumentId, String message) {
        super(message);
        this.instrumentId = instrumentId;
    }
}
