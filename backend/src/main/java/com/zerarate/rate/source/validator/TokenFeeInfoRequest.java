package com.zerarate.rate.source.validator;

import java.util.List;

/**
 * GetTokenFeeInfo request: instrument identifiers plus which optional sections to include.
 */
public record TokenFeeInfoRequest(List<String> contractIds, boolean includeRates, boolean includeContractFees) {

    public static TokenFeeInfoRequest withRates(List<String> contractIds) {
        return new TokenFeeInfoRequest(List.copyOf(contractIds), true, true);
    }
}
