package com.example.aurawatch.service;

import com.example.aurawatch.exception.TransportException;
import com.example.aurawatch.model.AuthorityKey;
import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.BlockHeader;
import com.example.aurawatch.model.ChainHead;
import com.example.aurawatch.model.PollState;
import com.example.aurawatch.model.SlotObservation;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.persistence.SlotLedger;
import com.example.aurawatch.rpc.ChainRpc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Moves our slots through schedule -> mint -> finality as the chain advances.
 *
 * Both triggers take the previous {@link PollState} and return the next one;
 * the reconciler itself holds no state. Store updates are guarded, so
 * observing the same head or finality range again changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleReconciler {

    private final ChainRpc chainRpc;
    private final SlotLedger ledger;
    private final ScheduleComputer scheduleComputer;
    private final Clock clock;

    /**
     * Mint detection. Runs once per distinct best head. The expected author
     * comes from the authority set current now, not the one the schedule was
     * computed from.
     */
    public PollState onBestHead(PollState state, ChainHead best, AuthoritySet authorities,
                                ValidatorIdentity identity) {
        if (best.getHash().equals(state.getLastBestHash())) {
            return state;
        }
        PollState next = state.toBuilder().lastBestHash(best.getHash()).build();

        OptionalLong slot = best.getHeader().slot();
        if (slot.isEmpty()) {
            log.debug("Best head #{} {} carries no Aura slot", best.getNumber(), best.getHash());
            return next;
        }

        Optional<AuthorityKey> expected = scheduleComputer.expectedAuthor(authorities, slot.getAsLong());
        if (expected.isPresent() && identity.matches(expected.get())) {
            ledger.markMinted(new SlotObservation(
                slot.getAsLong(),
                best.getNumber(),
                best.getHash(),
                producedTime(best.getHash())
            ));
        }
        return next;
    }

    /**
     * Finality scan over {@code (lastFinalized, finalized]}. Blocks that cannot be
     * resolved are skipped; the marker still advances to the finalized number.
     */
    public PollState onFinality(PollState state, ChainHead finalized) {
        long from = state.getLastFinalizedNumber();
        long to = finalized.getNumber();
        if (to <= from) {
            return state;
        }

        List<Long> skipped = new ArrayList<>();
        int finalizedSlots = 0;
        for (long n = from + 1; n <= to; n++) {
            try {
                Optional<String> hash = chainRpc.getBlockHash(n);
                if (hash.isEmpty()) {
                    skipped.add(n);
                    continue;
                }
                Optional<BlockHeader> header = chainRpc.getHeader(hash.get());
                if (header.isEmpty()) {
                    skipped.add(n);
                    continue;
                }
                OptionalLong slot = header.get().slot();
                if (slot.isEmpty()) {
                    continue;
                }
                boolean updated = ledger.markFinalized(new SlotObservation(
                    slot.getAsLong(),
                    n,
                    hash.get(),
                    producedTime(hash.get())
                ));
                if (updated) {
                    finalizedSlots++;
                }
            } catch (TransportException e) {
                log.warn("Skipping finalized block #{}: {}", n, e.getMessage());
                skipped.add(n);
            }
        }

        if (!skipped.isEmpty()) {
            log.warn("Finality scan #{}..#{} skipped {} unresolved blocks: {}", from + 1, to, skipped.size(), skipped);
        }
        log.debug("Finality advanced #{} -> #{}, {} of our slots finalized", from, to, finalizedSlots);

        return state.toBuilder().lastFinalizedNumber(to).build();
    }

    /**
     * {@code Timestamp.Now} at the block, or the local clock when the chain does not tell.
     */
    Instant producedTime(String blockHash) {
        try {
            Optional<Long> ms = chainRpc.getTimestampAt(blockHash);
            if (ms.isPresent()) {
                return Instant.ofEpochMilli(ms.get());
            }
            log.debug("No timestamp stored at {}, using local clock", blockHash);
        } catch (TransportException e) {
            log.debug("Timestamp lookup at {} failed, using local clock: {}", blockHash, e.getMessage());
        }
        return Instant.now(clock);
    }
}
