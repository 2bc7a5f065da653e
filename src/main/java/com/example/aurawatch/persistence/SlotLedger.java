package com.example.aurawatch.persistence;

import com.example.aurawatch.model.EpochInfo;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.SlotObservation;

import java.util.List;

/**
 * Durable record of epochs and of our slots' lifecycle. Every write is an
 * upsert or a guarded update, so repeating one leaves the store unchanged.
 */
public interface SlotLedger {

    /**
     * Inserts or overwrites the epoch row; {@code created_at} is kept from the first insert.
     */
    void upsertEpoch(EpochInfo info);

    /**
     * Writes the whole own schedule of an epoch in one transaction. New slots
     * start as scheduled; existing rows only get a new epoch and planned time
     * while they are still scheduled.
     */
    void recordSchedule(long epoch, List<PlannedSlot> slots);

    /**
     * Scheduled -> minted. Returns false when the row is missing or already past scheduled.
     */
    boolean markMinted(SlotObservation observation);

    /**
     * Scheduled or minted -> finalized. Returns false when the row is missing or already finalized.
     */
    boolean markFinalized(SlotObservation observation);
}
