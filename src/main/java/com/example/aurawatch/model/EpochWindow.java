package com.example.aurawatch.model;

import lombok.Value;

/**
 * Slot range of an epoch plus the number of slots actually scanned from its start.
 */
@Value
public class EpochWindow {
    long epoch;
    long startSlot;
    long endSlot;
    long scanLength;

    public static EpochWindow frame(long epoch, long epochSize, long scanLength) {
        long start = epoch * epochSize;
        return new EpochWindow(epoch, start, start + epochSize - 1, scanLength);
    }

    public long nextEpochStartSlot() {
        return endSlot + 1;
    }
}
