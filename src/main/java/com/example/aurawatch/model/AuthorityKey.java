package com.example.aurawatch.model;

import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * 32-byte public key of an authority. Immutable; equality is by content.
 */
@EqualsAndHashCode
public final class AuthorityKey {
    public static final int KEY_LENGTH = 32;

    private final byte[] value;

    private AuthorityKey(byte[] value) {
        if (value.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Key must be " + KEY_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, KEY_LENGTH);
    }

    public static AuthorityKey of(byte[] value) {
        return new AuthorityKey(value);
    }

    /**
     * Parses 64 hex characters, with or without a {@code 0x} prefix.
     */
    public static AuthorityKey fromHex(String hex) {
        String s = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (s.length() != KEY_LENGTH * 2) {
            throw new IllegalArgumentException("expected 32-byte hex, got " + s.length() / 2 + " bytes");
        }
        return new AuthorityKey(Hex.decode(s));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(value, KEY_LENGTH);
    }

    public String toHex() {
        return "0x" + Hex.toHexString(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
