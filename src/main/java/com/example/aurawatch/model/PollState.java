package com.example.aurawatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the previous iteration saw. Carried from one iteration to the next and
 * never persisted: losing it only re-emits output, it never corrupts the store.
 */
@Value
@Builder(toBuilder = true)
public class PollState {
    Fingerprint authorityFingerprint;
    int authorityLen;
    Long epoch;
    Fingerprint scheduleFingerprint;
    Boolean authorPresent;
    String lastBestHash;
    long lastFinalizedNumber;
    boolean identityReported;

    public static PollState initial(long finalityStartBlock) {
        return PollState.builder()
            .lastFinalizedNumber(finalityStartBlock)
            .build();
    }
}
