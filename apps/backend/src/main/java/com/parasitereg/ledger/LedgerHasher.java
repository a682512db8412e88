package com.parasitereg.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parasitereg.registry.model.ParasiteRecord;
import com.parasitereg.util.JsonCanonicalizer;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.LinkedHashMap;
import java.util.Map;

public final class LedgerHasher {
    private LedgerHasher() {}

    public static String sha256Hex(String s) {
        return DigestUtils.sha256Hex(s);
    }

    public static String canonicalize(ObjectMapper om, Map<String, Object> payload) {
        return JsonCanonicalizer.canonicalize(om, om.valueToTree(payload));
    }

    /** 链式哈希：hash = SHA256((prevHash or "") + canonical) */
    public static LedgerLink link(long recordId, String prev, String canonical) {
        return new LedgerLink(recordId, prev, sha256Hex((prev == null ? "" : prev) + canonical), canonical);
    }

    /**
     * 记录的不可变字段。status 会在归档时改变，不参与哈希。
     */
    public static Map<String, Object> buildRecordPayload(ParasiteRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("parasiteName", r.getParasiteName());
        m.put("classification", r.getClassification());
        m.put("location", r.getLocation());
        m.put("recordedAt", r.getRecordedAt());
        m.put("author", r.getAuthor().toHex());
        m.put("metadataHash", r.getMetadataHash().toHex());
        m.put("version", r.getVersion());
        if (r.getPreviousVersion() != null) m.put("previousVersion", r.getPreviousVersion());
        return m;
    }

    public static String canonicalRecord(ObjectMapper om, ParasiteRecord record) {
        return canonicalize(om, buildRecordPayload(record));
    }
}
