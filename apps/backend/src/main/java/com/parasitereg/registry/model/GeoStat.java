package com.parasitereg.registry.model;

import lombok.Value;

@Value
public class GeoStat {

    String region;

    long totalCases;

    long lastUpdated;

    public GeoStat increment(long sequence) {
        return new GeoStat(region, totalCases + 1, sequence);
    }
}
