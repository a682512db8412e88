package com.parasitereg.api.dto;

/** institutionId 为 null 表示该身份当前不属于任何机构 */
public record MembershipView(String identity, String institutionId) {}
