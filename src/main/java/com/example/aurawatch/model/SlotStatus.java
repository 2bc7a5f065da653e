package com.example.aurawatch.model;

/**
 * Lifecycle of one of our slots. Ordered: a slot only ever moves forward.
 */
public enum SlotStatus {
    SCHEDULED("schedule"),
    MINTED("mint"),
    FINALIZED("finality");

    private final String code;

    SlotStatus(String code) {
        this.code = code;
    }

    /**
     * Value stored in the {@code blocks.status} column.
     */
    public String getCode() {
        return code;
    }

    /**
     * Legal edges are SCHEDULED -> MINTED, MINTED -> FINALIZED and SCHEDULED -> FINALIZED.
     */
    public boolean canAdvanceTo(SlotStatus target) {
        return target.ordinal() > this.ordinal();
    }

    public static SlotStatus fromCode(String code) {
        for (SlotStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown slot status: " + code);
    }
}
