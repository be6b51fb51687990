package com.zerarate.rate.source.validator;

import reactor.core.publisher.Mono;

/**
 * Transport to the validator API service (GetTokenFeeInfo, ACETokens).
 */
public interface ValidatorFeeInfoClient {

    Mono<TokenFeeInfoResponse> getTokenFeeInfo(TokenFeeInfoRequest request);

    /**
     * All tokens the validator currently authorizes for fee payment, with their rates.
     */
    Mono<AceTokensResponse> getAceTokens();
}
