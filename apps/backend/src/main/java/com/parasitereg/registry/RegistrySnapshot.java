package com.parasitereg.registry;

import com.parasitereg.identity.Identity;
import com.parasitereg.ledger.LedgerLink;
import com.parasitereg.registry.model.GeoStat;
import com.parasitereg.registry.model.Institution;
import com.parasitereg.registry.model.ParasiteRecord;

import java.util.Map;

public record RegistrySnapshot(
        Identity owner,
        long recordCounter,
        String tailHash,
        Map<Long, ParasiteRecord> records,
        Map<Long, LedgerLink> ledger,
        Map<Long, Long> successors,
        Map<String, Institution> institutions,
        Map<Identity, String> memberships,
        Map<String, GeoStat> geoStats
) {}
