package com.example.aurawatch.model;

import lombok.Value;

/**
 * The operator's validator key, resolved once at startup.
 */
@Value
public class ValidatorIdentity {
    AuthorityKey key;
    String keyType;

    public String toHex() {
        return key.toHex();
    }

    public boolean matches(AuthorityKey other) {
        return key.equals(other);
    }
}
