package com.parasitereg.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.parasitereg.identity.Identity;
import lombok.Builder;
import lombok.Value;

/**
 * 账本中的一条不可变记录。归档时整体替换为 status=ARCHIVED 的副本，其余字段保持不变。
 */
@Value
@Builder(toBuilder = true)
public class ParasiteRecord {

    long id;

    String parasiteName;

    String classification;

    String location;

    /** 提交时的序列值 */
    long recordedAt;

    Identity author;

    MetadataHash metadataHash;

    RecordStatus status;

    long version;

    /** 前一版本的 id；创世版本为 null */
    Long previousVersion;

    @JsonIgnore
    public boolean isActive() {
        return status == RecordStatus.ACTIVE;
    }

    public ParasiteRecord archived() {
        return toBuilder().status(RecordStatus.ARCHIVED).build();
    }
}
