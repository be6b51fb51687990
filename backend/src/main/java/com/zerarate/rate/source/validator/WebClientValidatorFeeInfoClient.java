package com.zerarate.rate.source.validator;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Validator client using WebClient against the JSON-transcoded APIService endpoints
 * ({baseUrl}/zera_api.APIService/GetTokenFeeInfo and /ACETokens).
 */
public class WebClientValidatorFeeInfoClient implements ValidatorFeeInfoClient {

    static final String GET_TOKEN_FEE_INFO_PATH = "/zera_api.APIService/GetTokenFeeInfo";
    static final String ACE_TOKENS_PATH = "/zera_api.APIService/ACETokens";

    private final WebClient webClient;
    private final String baseUrl;

    public WebClientValidatorFeeInfoClient(WebClient.Builder builder, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Validator base URL is required");
        }
        this.webClient = builder.build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Mono<TokenFeeInfoResponse> getTokenFeeInfo(TokenFeeInfoRequest request) {
        return webClient.post()
                .uri(baseUrl + GET_TOKEN_FEE_INFO_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TokenFeeInfoResponse.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ValidatorClientException(
                                "Failed to get token fee info from validator: " + e.getMessage(), e));
    }

    @Override
    public Mono<AceTokensResponse> getAceTokens() {
        return webClient.post()
                .uri(baseUrl + ACE_TOKENS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .retrieve()
                .bodyToMono(AceTokensResponse.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ValidatorClientException(
                                "Failed to get ACE tokens from validator: " + e.getMessage(), e));
    }
}
