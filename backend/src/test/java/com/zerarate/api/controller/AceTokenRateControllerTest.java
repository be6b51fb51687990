package com.zerarate.api.controller;

import com.zerarate.rate.ace.AceTokenRate;
import com.zerarate.rate.ace.AceTokenRateService;
import com.zerarate.rate.source.validator.ValidatorClientException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
class AceTokenRateControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    AceTokenRateService aceTokenRateService;

    @Test
    @DisplayName("lists validator-authorized token rates")
    void listsRates() {
        when(aceTokenRateService.listRates()).thenReturn(List.of(
                new AceTokenRate("$ZRA+0000", new BigDecimal("0.1")),
                new AceTokenRate("$USDC+0001", new BigDecimal("1"))));

        webTestClient.get()
                .uri("/api/v1/rates/ace")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].contractId").isEqualTo("$ZRA+0000")
                .jsonPath("$[0].rate").isEqualTo(0.1)
                .jsonPath("$[1].contractId").isEqualTo("$USDC+0001");
    }

    @Test
    @DisplayName("single ACE token rate, or 404 NO_ACE_RATE when the validator does not list it")
    void singleRate() {
        when(aceTokenRateService.findRate("$ZRA+0000")).thenReturn(Optional.of(new BigDecimal("0.1")));
        when(aceTokenRateService.findRate("$ABC+0001")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/rates/ace/{id}", "$ZRA+0000")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.instrumentId").isEqualTo("$ZRA+0000")
                .jsonPath("$.rate").isEqualTo(0.1);

        webTestClient.get()
                .uri("/api/v1/rates/ace/{id}", "$ABC+0001")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NO_ACE_RATE");
    }

    @Test
    @DisplayName("validator failure maps to 503 VALIDATOR_UNAVAILABLE")
    void validatorFailure() {
        when(aceTokenRateService.listRates())
                .thenThrow(new ValidatorClientException("Failed to get ACE token rates from validator: timeout"));

        webTestClient.get()
                .uri("/api/v1/rates/ace")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATOR_UNAVAILABLE")
                .jsonPath("$.message").isEqualTo("Failed to get ACE token rates from validator: timeout");
    }
}
