package com.zerarate.rate.safeguard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MinimumRateSafeguardTest {

    private static final Map<String, BigDecimal> FLOORS = Map.of("$ZRA+0000", new BigDecimal("0.10"));

    @Test
    @DisplayName("rate below minimum is raised to the minimum")
    void raisesToMinimum() {
        MinimumRateSafeguard safeguard = new MinimumRateSafeguard(FLOORS, true);

        assertThat(safeguard.enforce(new BigDecimal("0.05"), "$ZRA+0000")).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("rate at or above minimum is returned unchanged")
    void keepsRateAtOrAboveMinimum() {
        MinimumRateSafeguard safeguard = new MinimumRateSafeguard(FLOORS, true);
        BigDecimal above = new BigDecimal("0.50");

        assertThat(safeguard.enforce(above, "$ZRA+0000")).isSameAs(above);
        assertThat(safeguard.enforce(new BigDecimal("0.1"), "$ZRA+0000")).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("instrument without minimum is unchanged")
    void noMinimumConfigured() {
        MinimumRateSafeguard safeguard = new MinimumRateSafeguard(FLOORS, true);

        assertThat(safeguard.enforce(new BigDecimal("0.01"), "$ABC+0001")).isEqualByComparingTo("0.01");
        assertThat(safeguard.minimumFor("$ABC+0001")).isEmpty();
    }

    @Test
    @DisplayName("disabled safeguard returns the rate unchanged")
    void disabled() {
        MinimumRateSafeguard safeguard = new MinimumRateSafeguard(FLOORS, false);

        assertThat(safeguard.enforce(new BigDecimal("0.01"), "$ZRA+0000")).isEqualByComparingTo("0.01");

        safeguard.setEnabled(true);
        assertThat(safeguard.enforce(new BigDecimal("0.01"), "$ZRA+0000")).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("merge overwrites floors for the same key and keeps the rest")
    void merge() {
        MinimumRateSafeguard safeguard = new MinimumRateSafeguard(FLOORS, true);

        safeguard.merge(Map.of("$ABC+0001", new BigDecimal("2")));
        safeguard.merge(Map.of("$ZRA+0000", new BigDecimal("0.20")));

        assertThat(safeguard.minimumFor("$ZRA+0000")).hasValue(new BigDecimal("0.20"));
        assertThat(safeguard.minimumFor("$ABC+0001")).hasValue(new BigDecimal("2"));
        assertThat(safeguard.enforce(new BigDecimal("1"), "$ABC+0001")).isEqualByComparingTo("2");
    }
}
