package com.prediction.worthhub.worth_hub.entity;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * 32-byte ledger identity (participant key, authority key or derived record address).
 *
 * Immutable. Persisted and exchanged as lower-case hex.
 */
public final class Identity implements Comparable<Identity> {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Identity(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap raw bytes (copied).
     */
    public static Identity of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Identity must be exactly " + LENGTH + " bytes");
        }
        return new Identity(bytes.clone());
    }

    /**
     * Parse a 64 character hex string.
     */
    public static Identity fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Identity hex must be " + LENGTH * 2 + " characters: " + hex);
        }
        try {
            return new Identity(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid identity hex: " + hex, e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public int compareTo(Identity other) {
        return Arrays.compareUnsigned(this.bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(bytes, ((Identity) obj).bytes);
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
