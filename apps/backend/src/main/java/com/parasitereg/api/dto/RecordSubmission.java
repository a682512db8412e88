package com.parasitereg.api.dto;

/**
 * 新建/更新记录的请求体。metadataHash 为链下流程算好的 32 字节摘要（64 位十六进制）。
 */
public record RecordSubmission(
        String parasiteName,
        String classification,
        String location,
        String metadataHash
) {}
