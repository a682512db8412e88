package com.parasitereg.registry.model;

/**
 * ACTIVE -> ARCHIVED 是唯一的状态迁移，且不可逆。
 */
public enum RecordStatus {
    ACTIVE,
    ARCHIVED
}
