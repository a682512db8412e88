package com.parasitereg.registry;

import com.parasitereg.registry.model.GeoStat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeoStatsAggregatorTest {

    private final RegistryFixture fx = new RegistryFixture();

    @Test
    void createsRegionLazilyAndCountsEachIncrement() {
        assertThat(fx.geoStats.get("Sub-Saharan Africa")).isEmpty();

        fx.state.write(() -> {
            fx.geoStats.increment("Sub-Saharan Africa", 10);
            fx.geoStats.increment("Sub-Saharan Africa", 12);
            fx.geoStats.increment("South Asia", 13);
            return null;
        });

        GeoStat africa = fx.geoStats.get("Sub-Saharan Africa").orElseThrow();
        assertThat(africa.getTotalCases()).isEqualTo(2);
        assertThat(africa.getLastUpdated()).isEqualTo(12);
        assertThat(fx.geoStats.get("South Asia").orElseThrow().getTotalCases()).isEqualTo(1);
    }

    @Test
    void regionKeysAreExactMatches() {
        fx.state.write(() -> {
            fx.geoStats.increment("Amazon Basin", 1);
            return null;
        });

        assertThat(fx.geoStats.get("amazon basin")).isEmpty();
        assertThat(fx.geoStats.get(null)).isEmpty();
    }
}
