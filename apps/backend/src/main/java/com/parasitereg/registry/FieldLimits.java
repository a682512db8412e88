package com.parasitereg.registry;

import static com.parasitereg.registry.RegistryError.INVALID_ARGUMENT;

final class FieldLimits {
    private FieldLimits() {}

    static final int PARASITE_NAME = 100;
    static final int CLASSIFICATION = 50;
    static final int LOCATION = 100;
    static final int INSTITUTION_ID = 50;
    static final int INSTITUTION_NAME = 100;

    static String require(String field, String value, int max) {
        if (value == null) {
            throw RegistryException.of(INVALID_ARGUMENT, "%s is required", field);
        }
        int len = value.codePointCount(0, value.length());
        if (len > max) {
            throw RegistryException.of(INVALID_ARGUMENT, "%s exceeds %d chars (got %d)", field, max, len);
        }
        return value;
    }

    static <T> T requirePresent(String field, T value) {
        if (value == null) {
            throw RegistryException.of(INVALID_ARGUMENT, "%s is required", field);
        }
        return value;
    }
}
