package com.parasitereg.registry;

import com.parasitereg.registry.model.GeoStat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 按地区累计的病例计数。只由 {@link RecordStore} 在创建记录的同一事务内调用 increment。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoStatsAggregator {

    private final RegistryState state;

    void increment(String region, long sequence) {
        GeoStat current = state.geoStat(region);
        if (current == null) {
            current = new GeoStat(region, 0, sequence);
        }
        GeoStat next = current.increment(sequence);
        state.putGeoStat(next);
        log.debug("[GEO][INC] region='{}' totalCases={} lastUpdated={}", region, next.getTotalCases(), sequence);
    }

    public Optional<GeoStat> get(String region) {
        return state.read(() -> Optional.ofNullable(state.geoStat(region)));
    }
}
