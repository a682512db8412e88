package com.parasitereg.api.dto;

public record RecordCreated(long id) {}
