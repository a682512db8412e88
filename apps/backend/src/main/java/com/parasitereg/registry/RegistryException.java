package com.parasitereg.registry;

import lombok.Getter;

@Getter
public class RegistryException extends RuntimeException {

    private final RegistryError error;

    public RegistryException(RegistryError error, String message) {
        super(message);
        this.error = error;
    }

    public static RegistryException of(RegistryError error, String format, Object... args) {
        return new RegistryException(error, String.format(format, args));
    }
}
