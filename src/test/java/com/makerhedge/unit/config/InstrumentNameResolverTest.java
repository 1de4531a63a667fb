package com.makerhedge.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.makerhedge.config.InstrumentNameResolver;
import java.util.List;
import org.junit.jupiter.api.Test;

class InstrumentNameResolverTest {

    private final InstrumentNameResolver resolver = new InstrumentNameResolver(
            List.of("BTC_USDT_Perp", "ETH_USDT_Perp", "ETH_BTC_Perp", "WBTC_USDT_Perp"));

    @Test
    void resolve_exactName() {
        assertThat(resolver.resolve("ETH_USDT_Perp")).contains("ETH_USDT_Perp");
    }

    @Test
    void resolve_anyCasePerpSuffix() {
        assertThat(resolver.resolve("BTC_USDT_PERP")).contains("BTC_USDT_Perp");
        assertThat(resolver.resolve("btc_usdt_perp")).contains("BTC_USDT_Perp");
        assertThat(resolver.resolve("  eth_usdt_Perp ")).contains("ETH_USDT_Perp");
    }

    @Test
    void resolve_unknownOrBlank() {
        assertThat(resolver.resolve("DOGE_USDT_Perp")).isEmpty();
        assertThat(resolver.resolve("  ")).isEmpty();
    }

    @Test
    void suggest_prefixMatchesBeforeSubstringMatches() {
        assertThat(resolver.suggest("BTC_USD")).containsExactly("BTC_USDT_Perp", "ETH_BTC_Perp", "WBTC_USDT_Perp");
    }

    @Test
    void suggest_nothingKnown() {
        assertThat(new InstrumentNameResolver(List.of()).suggest("BTC")).isEmpty();
    }
}
