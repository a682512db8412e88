package com.parasitereg.api.dto;

public record ErrorResponse(
        String error,     // RegistryError 名称，便于调用方分支
        String message
) {}
