package com.parasitereg.identity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

/**
 * 已认证调用方的不透明标识（地址长度的定长字节串）。
 * <p>
 * 核心只比较相等性，不解释内部结构，也不提供排序。十六进制只是传输编码。
 */
public final class Identity {

    public static final int SIZE = 20;

    private final byte[] bytes;

    private Identity(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Identity of(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE) {
            throw new IllegalArgumentException("identity must be exactly " + SIZE + " bytes");
        }
        return new Identity(bytes.clone());
    }

    @JsonCreator
    public static Identity fromHex(String hex) {
        if (hex == null || hex.length() != SIZE * 2) {
            throw new IllegalArgumentException("identity must be " + (SIZE * 2) + " hex chars");
        }
        try {
            return new Identity(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("identity is not valid hex", e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return Hex.encodeHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identity other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
