package com.parasitereg.registry.model;

import com.parasitereg.identity.Identity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Institution {

    String id;

    String name;

    /** 只会从 false 变为 true */
    boolean verified;

    Identity admin;
}
