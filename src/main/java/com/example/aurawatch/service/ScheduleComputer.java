package com.example.aurawatch.service;

import com.example.aurawatch.model.AuthorityKey;
import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.Fingerprint;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.rpc.ScaleCodec;
import com.example.aurawatch.util.Sha;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Round-robin slot assignment: slot {@code s} belongs to {@code authorities[s mod n]}.
 */
@Service
public class ScheduleComputer {

    /**
     * Our slots in {@code [startSlot, startSlot + windowLen)}, ascending.
     * Empty when there are no authorities.
     */
    public List<Long> ownSlots(AuthoritySet authorities, ValidatorIdentity identity, long startSlot, long windowLen) {
        List<Long> out = new ArrayList<>();
        if (authorities.isEmpty()) {
            return out;
        }
        for (long i = 0; i < windowLen; i++) {
            long slot = startSlot + i;
            if (identity.matches(assigned(authorities, slot))) {
                out.add(slot);
            }
        }
        return out;
    }

    public Optional<AuthorityKey> expectedAuthor(AuthoritySet authorities, long slot) {
        if (authorities.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(assigned(authorities, slot));
    }

    /**
     * SHA-256 over the slots' 8-byte little-endian encodings in ascending order.
     */
    public Fingerprint scheduleFingerprint(List<Long> slots) {
        List<byte[]> encoded = slots.stream().sorted().map(ScaleCodec::encodeU64).toList();
        return Sha.sha256(encoded);
    }

    /**
     * Linear projection from a reference slot; slots before the reference give earlier times.
     */
    public long projectTime(long slot, long referenceSlot, long referenceTimeMs, long slotDurationMs) {
        return referenceTimeMs + (slot - referenceSlot) * slotDurationMs;
    }

    private static AuthorityKey assigned(AuthoritySet authorities, long slot) {
        return authorities.get((int) Long.remainderUnsigned(slot, authorities.size()));
    }
}
