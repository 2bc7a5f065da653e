package com.example.aurawatch.model;

import lombok.Value;

/**
 * A block hash together with its header.
 */
@Value
public class ChainHead {
    String hash;
    BlockHeader header;

    public long getNumber() {
        return header.getNumber();
    }
}
