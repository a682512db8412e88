package com.parasitereg.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parasitereg.identity.Identity;
import com.parasitereg.ledger.LedgerEntry;
import com.parasitereg.ledger.LedgerHasher;
import com.parasitereg.ledger.LedgerLink;
import com.parasitereg.registry.model.MetadataHash;
import com.parasitereg.registry.model.ParasiteRecord;
import com.parasitereg.registry.model.RecordStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.parasitereg.registry.RegistryError.INVALID_RECORD;

/**
 * 版本化的记录账本。
 * <p>
 * 记录一经写入内容不再改变；更新会把旧版本归档并追加一个 version+1 的新记录，
 * 新记录通过 previousVersion 指回旧版本，形成按 id 严格递减的有限回溯链。
 * 每次成功创建（无论创世版本还是更新产生的版本）都在同一事务内：
 * 分配 id、写入记录、挂到账本哈希链、对目标地区计数 +1。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordStore {

    private final RegistryState state;
    private final AccessControl access;
    private final GeoStatsAggregator geoStats;
    private final SequenceClock clock;
    private final ObjectMapper objectMapper;

    public long addRecord(String parasiteName, String classification, String location,
                          MetadataHash metadataHash, Identity caller) {
        return state.write(() -> {
            access.requireVerifiedMember(caller);
            validate(parasiteName, classification, location, metadataHash);

            ParasiteRecord created = commit(prepare(parasiteName, classification, location, metadataHash,
                    caller, 1L, null));
            log.info("[RECORD][ADD] id={} author={} location='{}'", created.getId(), caller, location);
            return created.getId();
        });
    }

    public long updateRecord(long existingId, String parasiteName, String classification, String location,
                             MetadataHash metadataHash, Identity caller) {
        return state.write(() -> {
            ParasiteRecord existing = state.record(existingId);
            if (existing == null) {
                throw RegistryException.of(INVALID_RECORD, "record %d does not exist", existingId);
            }
            if (!existing.isActive()) {
                throw RegistryException.of(INVALID_RECORD,
                        "record %d is %s; only the latest version can be updated", existingId, existing.getStatus());
            }
            access.requireVerifiedMember(caller);
            access.requireAuthorOrOwnInstitutionAdmin(caller, existing);
            validate(parasiteName, classification, location, metadataHash);

            // 新版本与链节点先全部算好，再统一落表
            Pending next = prepare(parasiteName, classification, location, metadataHash,
                    caller, existing.getVersion() + 1, existing.getId());
            state.putRecord(existing.archived());
            ParasiteRecord created = commit(next);
            state.linkSuccessor(existing.getId(), created.getId());
            log.info("[RECORD][UPDATE] id={} -> id={} version={} caller={}",
                    existingId, created.getId(), created.getVersion(), caller);
            return created.getId();
        });
    }

    public Optional<ParasiteRecord> getRecord(long id) {
        return state.read(() -> Optional.ofNullable(state.record(id)));
    }

    /**
     * 该记录及其全部祖先，按 新 -> 旧 排列。每次调用重新计算。
     */
    public List<ParasiteRecord> getRecordHistory(long id) {
        return state.read(() -> history(id));
    }

    /** 同一读锁内取出的谱系、直接后继与链节点，供一致性校验使用 */
    public Lineage getLineage(long id) {
        return state.read(() -> {
            List<ParasiteRecord> history = history(id);
            return new Lineage(history, state.successorOf(id), state.ledgerLink(id));
        });
    }

    private List<ParasiteRecord> history(long id) {
        ParasiteRecord current = state.record(id);
        if (current == null) {
            throw RegistryException.of(INVALID_RECORD, "record %d does not exist", id);
        }
        List<ParasiteRecord> history = new ArrayList<>((int) Math.min(current.getVersion(), 64));
        history.add(current);
        while (current.getPreviousVersion() != null) {
            ParasiteRecord previous = state.record(current.getPreviousVersion());
            if (previous == null || previous.getId() >= current.getId()) {
                throw new IllegalStateException("broken lineage at record " + current.getId());
            }
            history.add(previous);
            current = previous;
        }
        log.debug("[RECORD][HISTORY] id={} -> {} version(s)", id, history.size());
        return history;
    }

    /** 包含该 id 的谱系中最新的版本 */
    public ParasiteRecord getLatestVersion(long id) {
        return state.read(() -> {
            ParasiteRecord current = state.record(id);
            if (current == null) {
                throw RegistryException.of(INVALID_RECORD, "record %d does not exist", id);
            }
            Long next = state.successorOf(current.getId());
            while (next != null) {
                current = state.record(next);
                next = state.successorOf(current.getId());
            }
            return current;
        });
    }

    public long getTotalRecords() {
        return state.read(state::recordCounter);
    }

    /** 账本时间线（按 id 升序），供校验与导出使用 */
    public List<LedgerEntry> ledgerTimeline() {
        return state.read(() -> {
            List<LedgerEntry> out = new ArrayList<>();
            for (ParasiteRecord r : state.recordsInIdOrder()) {
                out.add(new LedgerEntry(r, state.ledgerLink(r.getId())));
            }
            return out;
        });
    }

    public Optional<String> getTailHash() {
        return state.read(() -> Optional.ofNullable(state.tailHash()));
    }

    /** 只计算，不改动状态：新记录使用下一个待分配的 id，并挂在当前链尾之后 */
    private Pending prepare(String parasiteName, String classification, String location,
                            MetadataHash metadataHash, Identity author, long version, Long previousVersion) {
        long sequence = clock.current();
        ParasiteRecord record = ParasiteRecord.builder()
                .id(state.recordCounter() + 1)
                .parasiteName(parasiteName)
                .classification(classification)
                .location(location)
                .recordedAt(sequence)
                .author(author)
                .metadataHash(metadataHash)
                .status(RecordStatus.ACTIVE)
                .version(version)
                .previousVersion(previousVersion)
                .build();
        String canonical = LedgerHasher.canonicalRecord(objectMapper, record);
        return new Pending(record, LedgerHasher.link(record.getId(), state.tailHash(), canonical), sequence);
    }

    private ParasiteRecord commit(Pending pending) {
        ParasiteRecord record = pending.record();
        long id = state.allocateRecordId();
        if (id != record.getId()) {
            throw new IllegalStateException("record id moved from " + record.getId() + " to " + id);
        }
        state.putRecord(record);
        state.appendLedgerLink(pending.link());
        geoStats.increment(record.getLocation(), pending.sequence());
        return record;
    }

    private static void validate(String parasiteName, String classification, String location,
                                 MetadataHash metadataHash) {
        FieldLimits.require("parasite name", parasiteName, FieldLimits.PARASITE_NAME);
        FieldLimits.require("classification", classification, FieldLimits.CLASSIFICATION);
        FieldLimits.require("location", location, FieldLimits.LOCATION);
        FieldLimits.requirePresent("metadata hash", metadataHash);
    }

    private record Pending(ParasiteRecord record, LedgerLink link, long sequence) {}

    public record Lineage(List<ParasiteRecord> history, Long successorId, LedgerLink link) {}
}
