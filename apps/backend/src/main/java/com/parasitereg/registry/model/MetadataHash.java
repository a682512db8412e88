package com.parasitereg.registry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

/**
 * 调用方提供的 32 字节内容摘要，由链下存储/哈希流程生成，这里从不解引用。
 */
public final class MetadataHash {

    public static final int SIZE = 32;

    private final byte[] bytes;

    private MetadataHash(byte[] bytes) {
        this.bytes = bytes;
    }

    public static MetadataHash of(byte[] bytes) {
        if (bytes == null || bytes.length != SIZE) {
            throw new IllegalArgumentException("metadata hash must be exactly " + SIZE + " bytes");
        }
        return new MetadataHash(bytes.clone());
    }

    @JsonCreator
    public static MetadataHash fromHex(String hex) {
        if (hex == null || hex.length() != SIZE * 2) {
            throw new IllegalArgumentException("metadata hash must be " + (SIZE * 2) + " hex chars");
        }
        try {
            return new MetadataHash(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("metadata hash is not valid hex", e);
        }
    }

    @JsonValue
    public String toHex() {
        return Hex.encodeHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataHash other)) return false;
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
