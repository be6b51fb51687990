package com.zerarate.rate.fallback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackRateTableTest {

    @Test
    @DisplayName("exact entry wins over symbol family entry")
    void exactBeatsSymbol() {
        FallbackRateTable table = new FallbackRateTable(Map.of(
                "$ZRA+0042", new BigDecimal("0.42"),
                "$ZRA+0000", new BigDecimal("0.10")));

        FallbackRateInfo info = table.lookup("$ZRA+0042").orElseThrow();

        assertThat(info.matchType()).isEqualTo(FallbackMatchType.EXACT_MATCH);
        assertThat(info.sourceKey()).isEqualTo("$ZRA+0042");
        assertThat(info.rate()).isEqualByComparingTo("0.42");
    }

    @Test
    @DisplayName("issuance without exact entry falls back to its symbol family")
    void symbolMatch() {
        FallbackRateTable table = new FallbackRateTable(Map.of("$ZRA+0000", new BigDecimal("0.10")));

        FallbackRateInfo info = table.lookup("$ZRA+0007").orElseThrow();

        assertThat(info.matchType()).isEqualTo(FallbackMatchType.SYMBOL_MATCH);
        assertThat(info.sourceKey()).isEqualTo("$ZRA+0000");
        assertThat(info.rate()).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("no entry and no symbol family yields empty")
    void noMatch() {
        FallbackRateTable table = new FallbackRateTable(Map.of("$ZRA+0000", new BigDecimal("0.10")));

        assertThat(table.lookup("$ABC+0001")).isEmpty();
        assertThat(table.lookup("INVALID_NO_FALLBACK")).isEmpty();
        assertThat(table.lookup(null)).isEmpty();
    }

    @Test
    @DisplayName("non-canonical identifier still matches exactly")
    void nonCanonicalExact() {
        FallbackRateTable table = new FallbackRateTable(Map.of("custom-token", new BigDecimal("3")));

        assertThat(table.lookup("custom-token"))
                .hasValueSatisfying(i -> assertThat(i.matchType()).isEqualTo(FallbackMatchType.EXACT_MATCH));
    }

    @Test
    @DisplayName("merge overwrites same keys and preserves others")
    void mergeSemantics() {
        FallbackRateTable table = new FallbackRateTable(Map.of(
                "$ZRA+0000", new BigDecimal("0.10"),
                "$ABC+0000", new BigDecimal("1")));

        table.merge(Map.of("$ZRA+0000", new BigDecimal("0.20"), "$XYZ+0003", new BigDecimal("7")));

        assertThat(table.asMap())
                .containsEntry("$ZRA+0000", new BigDecimal("0.20"))
                .containsEntry("$ABC+0000", new BigDecimal("1"))
                .containsEntry("$XYZ+0003", new BigDecimal("7"))
                .hasSize(3);
    }

    @Test
    @DisplayName("match types describe their source key")
    void describe() {
        assertThat(FallbackMatchType.EXACT_MATCH.describe("$ZRA+0000")).isEqualTo("exact match for $ZRA+0000");
        assertThat(FallbackMatchType.SYMBOL_MATCH.describe("$ZRA+0000")).isEqualTo("symbol match using $ZRA+0000");
    }
}
