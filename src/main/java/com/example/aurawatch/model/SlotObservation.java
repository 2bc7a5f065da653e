package com.example.aurawatch.model;

import lombok.Value;

import java.time.Instant;

/**
 * A block seen on chain for a given slot.
 */
@Value
public class SlotObservation {
    long slot;
    long blockNumber;
    String blockHash;
    Instant producedTime;
}
