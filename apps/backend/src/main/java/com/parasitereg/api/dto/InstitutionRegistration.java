package com.parasitereg.api.dto;

public record InstitutionRegistration(String id, String name) {}
