package com.example.aurawatch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.OptionalLong;

/**
 * The parts of a block header the monitor reads.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlockHeader {
    private long number;

    /**
     * Slot from the Aura pre-runtime digest, or null if the header carries none.
     */
    private Long auraSlot;

    public OptionalLong slot() {
        return auraSlot != null ? OptionalLong.of(auraSlot) : OptionalLong.empty();
    }
}
