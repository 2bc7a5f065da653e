package com.example.aurawatch.model;

import lombok.Value;

/**
 * Epoch metadata recorded whenever an epoch is (re)observed.
 */
@Value
public class EpochInfo {
    long epoch;
    long startSlot;
    long endSlot;
    String authoritySetHash;
    int authoritySetLen;
}
