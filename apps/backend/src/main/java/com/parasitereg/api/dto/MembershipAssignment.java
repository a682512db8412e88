package com.parasitereg.api.dto;

public record MembershipAssignment(String institutionId) {}
