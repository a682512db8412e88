package com.parasitereg.controller;

import com.parasitereg.identity.Identity;
import com.parasitereg.registry.RegistryError;
import com.parasitereg.registry.RegistryException;
import com.parasitereg.registry.model.MetadataHash;

/**
 * 上游认证网关把已认证调用方写入该请求头（40 位十六进制）。
 * 请求里的十六进制值在这里解析，格式错误统一转成 INVALID_ARGUMENT。
 */
final class CallerHeaders {
    private CallerHeaders() {}

    static final String CALLER = "X-Caller-Identity";

    static Identity caller(String header) {
        return identity(CALLER, header);
    }

    static Identity identity(String field, String hex) {
        try {
            return Identity.fromHex(hex == null ? null : hex.trim());
        } catch (IllegalArgumentException e) {
            throw RegistryException.of(RegistryError.INVALID_ARGUMENT, "%s: %s", field, e.getMessage());
        }
    }

    static MetadataHash metadataHash(String hex) {
        if (hex == null) {
            return null;
        }
        try {
            return MetadataHash.fromHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw RegistryException.of(RegistryError.INVALID_ARGUMENT, "metadataHash: %s", e.getMessage());
        }
    }
}
