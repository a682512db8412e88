package com.parasitereg.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parasitereg.registry.RecordStore;
import com.parasitereg.registry.model.ParasiteRecord;
import com.parasitereg.registry.model.RecordStatus;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 按 id 升序重放账本哈希链：
 *   - prevHash 是否等于上一条的 hash
 *   - canonical 是否等于由当前记录重新计算的规范形式（发现记录内容被改动）
 *   - hash 是否等于 LedgerHasher.link(prev, canonical).hash()
 * 返回全部断点与链尾哈希。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerVerifyService {

    private final RecordStore recordStore;
    private final ObjectMapper objectMapper;

    public Report verify() {
        List<LedgerEntry> timeline = fetchTimeline();
        Report report = verifyTimeline(timeline);
        if (report.ok()) {
            log.debug("[LEDGER][VERIFY] ok nodes={} tail={}", report.totalNodes(), report.tailHash());
        } else {
            log.warn("[LEDGER][VERIFY] {} break(s), first at index {}", report.breaks().size(), report.firstBadIndex());
        }
        return report;
    }

    /** 链尾哈希与节点数，直接读取，不重放整条链 */
    public Tail tail() {
        return new Tail(recordStore.getTotalRecords(), recordStore.getTailHash().orElse(null));
    }

    /** 给导出服务共用的取数方法（单一数据口径） */
    public List<LedgerEntry> fetchTimeline() {
        return recordStore.ledgerTimeline();
    }

    /**
     * 单条记录的校验：记录存在、谱系一致（id 递减、版本连续、旧版本已归档、最新版本处于 ACTIVE）、
     * 且该记录的链节点可以重新计算出来。
     */
    public RecordVerification verifyRecord(long recordId) {
        RecordStore.Lineage lineage = recordStore.getLineage(recordId);
        List<ParasiteRecord> history = lineage.history();
        ParasiteRecord head = history.get(0);
        List<String> issues = new ArrayList<>();

        for (int i = 0; i + 1 < history.size(); i++) {
            ParasiteRecord newer = history.get(i);
            ParasiteRecord older = history.get(i + 1);
            if (older.getId() >= newer.getId()) {
                issues.add("record " + newer.getId() + " points to non-earlier id " + older.getId());
            }
            if (newer.getVersion() != older.getVersion() + 1) {
                issues.add("record " + newer.getId() + " has version " + newer.getVersion()
                        + " but predecessor has " + older.getVersion());
            }
            if (older.getStatus() != RecordStatus.ARCHIVED) {
                issues.add("superseded record " + older.getId() + " is still " + older.getStatus());
            }
        }
        ParasiteRecord genesis = history.get(history.size() - 1);
        if (genesis.getVersion() != 1) {
            issues.add("genesis record " + genesis.getId() + " has version " + genesis.getVersion());
        }
        boolean superseded = lineage.successorId() != null;
        if (superseded == head.isActive()) {
            issues.add("record " + head.getId() + " is " + head.getStatus()
                    + (superseded ? " but has a newer version" : " but is the latest version"));
        }

        Optional<LedgerLink> link = Optional.ofNullable(lineage.link());
        String chainHash = null;
        if (link.isEmpty()) {
            issues.add("record " + recordId + " has no ledger link");
        } else {
            LedgerLink stored = link.get();
            chainHash = stored.hash();
            String canonical = LedgerHasher.canonicalRecord(objectMapper, head);
            if (!canonical.equals(stored.canonical())) {
                issues.add("record " + recordId + " content differs from its ledger entry");
            }
            if (!LedgerHasher.link(recordId, stored.prevHash(), stored.canonical()).hash().equals(stored.hash())) {
                issues.add("ledger hash of record " + recordId + " does not recompute");
            }
        }

        log.debug("[LEDGER][VERIFY-RECORD] id={} lineage={} issues={}", recordId, history.size(), issues.size());
        return new RecordVerification(recordId, issues.isEmpty(), head.getStatus(), head.getVersion(),
                history.size(), chainHash, List.copyOf(issues), Instant.now());
    }

    /** 核心校验逻辑 */
    Report verifyTimeline(List<LedgerEntry> rows) {
        List<Break> breaks = new ArrayList<>();
        String prev = null;
        String tail = null;

        for (int i = 0; i < rows.size(); i++) {
            LedgerEntry row = rows.get(i);
            ParasiteRecord record = row.record();
            LedgerLink stored = row.link();

            String expectCanonical = LedgerHasher.canonicalRecord(objectMapper, record);
            String storedCanonical = stored == null ? null : stored.canonical();
            String storedPrev = stored == null ? null : stored.prevHash();
            String storedHash = stored == null ? null : stored.hash();

            // 期望值按存储的 canonical 计算，内容篡改由 canonicalMatch 单独报告
            LedgerLink expected = LedgerHasher.link(record.getId(), prev,
                    storedCanonical != null ? storedCanonical : expectCanonical);

            boolean prevOk = stored != null && Objects.equals(storedPrev, expected.prevHash());
            boolean hashOk = stored != null && Objects.equals(storedHash, expected.hash());
            boolean canonicalOk = Objects.equals(storedCanonical, expectCanonical);

            if (!(prevOk && hashOk && canonicalOk)) {
                breaks.add(new Break(i, record.getId(),
                        expected.prevHash(), storedPrev,
                        expected.hash(), storedHash,
                        prevOk, hashOk, canonicalOk));
            }

            // 按“实际链”推进，第一个坏点之后的节点也能各自定位
            tail = storedHash != null ? storedHash : expected.hash();
            prev = tail;
        }

        Integer firstBad = breaks.isEmpty() ? null : breaks.get(0).getIndex();
        return new Report(rows.size(), breaks.isEmpty(), firstBad, breaks, tail);
    }

    // ====== 报告结构 ======

    public record Report(
            int totalNodes,
            boolean ok,
            Integer firstBadIndex,
            List<Break> breaks,
            String tailHash
    ) {}

    public record Tail(long totalNodes, String tailHash) {}

    public record RecordVerification(
            long recordId,
            boolean verified,
            RecordStatus status,
            long version,
            int lineageLength,
            String chainHash,
            List<String> issues,
            Instant checkedAt
    ) {}

    /** 断点详情 */
    @Getter
    @ToString
    public static class Break {
        private final int index;                 // 在时间线中的索引（从 0 起）
        private final long recordId;
        private final String expectPrev;
        private final String actualPrev;
        private final String expectHash;
        private final String actualHash;
        private final boolean prevMatch;
        private final boolean hashMatch;
        private final boolean canonicalMatch;

        public Break(int index, long recordId,
                     String expectPrev, String actualPrev,
                     String expectHash, String actualHash,
                     boolean prevMatch, boolean hashMatch, boolean canonicalMatch) {
            this.index = index;
            this.recordId = recordId;
            this.expectPrev = expectPrev;
            this.actualPrev = actualPrev;
            this.expectHash = expectHash;
            this.actualHash = actualHash;
            this.prevMatch = prevMatch;
            this.hashMatch = hashMatch;
            this.canonicalMatch = canonicalMatch;
        }
    }
}
