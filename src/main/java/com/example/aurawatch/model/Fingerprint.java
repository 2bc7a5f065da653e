package com.example.aurawatch.model;

import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * Content digest used only to notice that something changed.
 */
@EqualsAndHashCode
public final class Fingerprint {

    private final byte[] value;

    public Fingerprint(byte[] value) {
        this.value = Arrays.copyOf(value, value.length);
    }

    public String toHex() {
        return "0x" + Hex.toHexString(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
