package com.parasitereg.registry;

import com.parasitereg.identity.Identity;
import com.parasitereg.ledger.LedgerLink;
import com.parasitereg.registry.model.GeoStat;
import com.parasitereg.registry.model.Institution;
import com.parasitereg.registry.model.ParasiteRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 注册表的全部可变状态：记录表、机构表、成员表、地区统计表、id 计数器与账本链尾。
 * <p>
 * 进程内只实例化一次，由各组件共享。所有写操作在写锁内整体执行，校验先于任何修改，
 * 因此失败的操作不会留下部分结果；读操作在读锁内只能看到已提交的状态。
 * 包内的 getter/mutator 不加锁，调用方必须已处于 {@link #read} 或 {@link #write} 之中。
 */
@Slf4j
public class RegistryState {

    @Getter
    private final Identity owner;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    // 按 id 追加、只读不删
    private final TreeMap<Long, ParasiteRecord> records = new TreeMap<>();
    private final TreeMap<Long, LedgerLink> ledger = new TreeMap<>();
    // 旧版本 id -> 直接后继 id
    private final Map<Long, Long> successors = new HashMap<>();
    private final Map<String, Institution> institutions = new HashMap<>();
    private final Map<Identity, String> memberships = new HashMap<>();
    private final Map<String, GeoStat> geoStats = new HashMap<>();

    private long recordCounter;
    private String tailHash;

    public RegistryState(Identity owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
        log.info("Registry state created owner={}", owner);
    }

    public <T> T read(Supplier<T> action) {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    <T> T write(Supplier<T> action) {
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    /** 完整状态快照，用于比较操作前后是否有任何变化 */
    public RegistrySnapshot snapshot() {
        return read(() -> new RegistrySnapshot(
                owner,
                recordCounter,
                tailHash,
                Map.copyOf(records),
                Map.copyOf(ledger),
                Map.copyOf(successors),
                Map.copyOf(institutions),
                Map.copyOf(memberships),
                Map.copyOf(geoStats)));
    }

    // ===== records =====

    ParasiteRecord record(long id) {
        return records.get(id);
    }

    Iterable<ParasiteRecord> recordsInIdOrder() {
        return records.values();
    }

    long recordCounter() {
        return recordCounter;
    }

    long allocateRecordId() {
        return ++recordCounter;
    }

    void putRecord(ParasiteRecord record) {
        records.put(record.getId(), record);
    }

    Long successorOf(long id) {
        return successors.get(id);
    }

    void linkSuccessor(long previousId, long nextId) {
        successors.put(previousId, nextId);
    }

    // ===== ledger =====

    LedgerLink ledgerLink(long recordId) {
        return ledger.get(recordId);
    }

    String tailHash() {
        return tailHash;
    }

    void appendLedgerLink(LedgerLink link) {
        ledger.put(link.recordId(), link);
        tailHash = link.hash();
    }

    // ===== institutions =====

    Institution institution(String id) {
        return id == null ? null : institutions.get(id);
    }

    Iterable<Institution> institutions() {
        return new TreeMap<>(institutions).values();
    }

    void putInstitution(Institution institution) {
        institutions.put(institution.getId(), institution);
    }

    // ===== memberships =====

    String membership(Identity identity) {
        return identity == null ? null : memberships.get(identity);
    }

    void putMembership(Identity identity, String institutionId) {
        memberships.put(identity, institutionId);
    }

    String removeMembership(Identity identity) {
        return memberships.remove(identity);
    }

    // ===== geo stats =====

    GeoStat geoStat(String region) {
        return region == null ? null : geoStats.get(region);
    }

    void putGeoStat(GeoStat stat) {
        geoStats.put(stat.getRegion(), stat);
    }
}
