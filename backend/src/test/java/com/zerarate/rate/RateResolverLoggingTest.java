package com.zerarate.rate;

import com.zerarate.domain.RateSource;
import com.zerarate.support.FakeRateSource;
import com.zerarate.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Operational warnings emitted on degraded resolution and floor enforcement.
 */
@ExtendWith(OutputCaptureExtension.class)
class RateResolverLoggingTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("fallback warning lists failed steps, exact match key and the rate")
    void exactFallbackWarning(CapturedOutput output) {
        RateResolver resolver = new RateResolver(RateResolverSettings.defaults(), List.of(
                FakeRateSource.failing(RateSource.INDEXER, "HTTP 503: Service Unavailable"),
                FakeRateSource.failing(RateSource.VALIDATOR, "connection refused")), clock);

        resolver.resolve("$ZRA+0000");

        assertThat(output.getOut())
                .contains("All rate sources failed for \"$ZRA+0000\"")
                .contains("indexer: HTTP 503: Service Unavailable; validator: connection refused")
                .contains("Using fallback rate: 0.10 USD per $ZRA+0000")
                .contains("(source: exact match for $ZRA+0000)");
    }

    @Test
    @DisplayName("symbol-family fallback warning names the family key")
    void symbolFallbackWarning(CapturedOutput output) {
        RateResolver resolver = new RateResolver(RateResolverSettings.defaults(), List.of(
                FakeRateSource.failing(RateSource.VALIDATOR, "no rate returned for $ZRA+0042")), clock);

        resolver.resolve("$ZRA+0042");

        assertThat(output.getOut())
                .contains("validator: no rate returned for $ZRA+0042")
                .contains("(source: symbol match using $ZRA+0000)");
    }

    @Test
    @DisplayName("warning without live sources says none are configured")
    void noLiveSourcesWarning(CapturedOutput output) {
        new RateResolver(RateResolverSettings.defaults(), List.of(), clock).resolve("$ZRA+0000");

        assertThat(output.getOut()).contains("(no live rate sources configured)");
    }

    @Test
    @DisplayName("raising a rate to its floor emits a safeguard warning")
    void safeguardWarning(CapturedOutput output) {
        RateResolverSettings settings = new RateResolverSettings(
                Duration.ofMillis(3000), Map.of(), Map.of("$ABC+0001", new BigDecimal("2")), true);
        RateResolver resolver = new RateResolver(settings,
                List.of(FakeRateSource.returning(RateSource.INDEXER, "1.5")), clock);

        assertThat(resolver.resolve("$ABC+0001")).isEqualByComparingTo("2");

        assertThat(output.getOut()).contains("Rate 1.5 for $ABC+0001 below minimum 2, applying safeguard");
    }

    @Test
    @DisplayName("live success and rates at the floor log no warnings")
    void healthyResolutionIsQuiet(CapturedOutput output) {
        RateResolver resolver = new RateResolver(RateResolverSettings.defaults(),
                List.of(FakeRateSource.returning(RateSource.VALIDATOR, "0.10")), clock);

        resolver.resolve("$ZRA+0000");

        assertThat(output.getOut())
                .doesNotContain("All rate sources failed")
                .doesNotContain("applying safeguard");
    }
}
