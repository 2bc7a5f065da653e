package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.TransportException;
import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.BlockHeader;
import com.example.aurawatch.model.ChainHead;
import com.example.aurawatch.model.EpochInfo;
import com.example.aurawatch.model.EpochWindow;
import com.example.aurawatch.model.Fingerprint;
import com.example.aurawatch.model.IterationOutcome;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.PollState;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.persistence.SlotLedger;
import com.example.aurawatch.rpc.ChainRpc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the monitor: fetch, detect changes, compute the schedule, reconcile, persist, sleep.
 *
 * Runs on the caller's thread. Any RPC failure outside the finality scan ends the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollScheduler {

    /**
     * Wake this long after the estimated epoch boundary.
     */
    static final Duration BOUNDARY_MARGIN = Duration.ofSeconds(1);

    private final MonitorConfig config;
    private final ChainRpc chainRpc;
    private final AuthoritySetTracker authorityTracker;
    private final ScheduleComputer scheduleComputer;
    private final LifecycleReconciler reconciler;
    private final SlotLedger ledger;
    private final ScheduleReporter reporter;
    private final Sleeper sleeper;

    /**
     * One iteration in one-shot mode, or iterations until a fatal error in watch mode.
     */
    public PollState run(ValidatorIdentity identity) {
        PollState state = PollState.initial(config.getFinalityStartBlock());
        while (true) {
            IterationOutcome outcome = runIteration(identity, state);
            state = outcome.getNextState();
            if (!config.isWatch()) {
                return state;
            }
            log.debug("Epoch {} at slot {}, sleeping {}s",
                    outcome.getWindow().getEpoch(), outcome.getLatestSlot(), outcome.getSleep().toSeconds());
            try {
                sleeper.sleep(outcome.getSleep());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Interrupted, stopping watch loop");
                return state;
            }
        }
    }

    public IterationOutcome runIteration(ValidatorIdentity identity, PollState state) {
        // Authority set
        AuthoritySet authorities = authorityTracker.fetch();
        Fingerprint authorityFingerprint = authorityTracker.fingerprint(authorities);
        boolean changed = authorityTracker.changed(state.getAuthorityFingerprint(), state.getAuthorityLen(),
                authorityFingerprint, authorities.size());

        PollState.PollStateBuilder next = state.toBuilder();
        if (changed) {
            if (state.getAuthorityFingerprint() != null) {
                reporter.authoritySetChanged(state.getAuthorityLen(), authorities.size());
                log.info("Authority set changed: {} -> {} members", state.getAuthorityLen(), authorities.size());
            }
            next.authorityFingerprint(authorityFingerprint).authorityLen(authorities.size());
        }

        // Chain position
        long slotDuration = chainRpc.getSlotDuration();
        if (slotDuration <= 0) {
            throw new TransportException(ErrorCode.RPC_MALFORMED_RESULT,
                "node reported a non-positive slot duration: " + slotDuration);
        }
        long nowMs = chainRpc.getTimestamp().orElse(0L);
        String bestHash = chainRpc.getBestBlockHash()
            .orElseThrow(() -> new TransportException(ErrorCode.MISSING_CHAIN_DATA, "no best head"));
        BlockHeader bestHeader = chainRpc.getHeader(bestHash)
            .orElseThrow(() -> new TransportException(ErrorCode.MISSING_CHAIN_DATA, "no best header"));
        ChainHead best = new ChainHead(bestHash, bestHeader);

        // Prefer the slot from the block digest; timestamp / slot duration is only a fallback.
        long latestSlot = bestHeader.slot().orElse(nowMs / slotDuration);

        long epoch = config.isEpochPinned() ? config.getEpoch() : latestSlot / config.getEpochSize();
        EpochWindow window = EpochWindow.frame(epoch, config.getEpochSize(), config.scanLength());
        boolean epochSwitched = !Objects.equals(state.getEpoch(), epoch);

        if (changed || epochSwitched) {
            reporter.epoch(window);
            ledger.upsertEpoch(new EpochInfo(epoch, window.getStartSlot(), window.getEndSlot(),
                    authorityFingerprint.toHex(), authorities.size()));
        }

        if (!state.isIdentityReported()) {
            reporter.identity(identity);
            next.identityReported(true);
        }

        // Own schedule
        boolean present = authorityTracker.contains(authorities, identity);
        boolean presenceChanged = !Objects.equals(state.getAuthorPresent(), present);
        next.authorPresent(present);

        if (!present) {
            if (changed || presenceChanged || epochSwitched) {
                reporter.notAnAuthority(epoch, authorities.size());
            }
            next.epoch(epoch);
        } else {
            List<Long> ownSlots = scheduleComputer.ownSlots(authorities, identity,
                    window.getStartSlot(), window.getScanLength());
            Fingerprint scheduleFingerprint = scheduleComputer.scheduleFingerprint(ownSlots);
            boolean scheduleChanged = !scheduleFingerprint.equals(state.getScheduleFingerprint());

            if (scheduleChanged || epochSwitched) {
                next.scheduleFingerprint(scheduleFingerprint).epoch(epoch);
                List<PlannedSlot> planned = ownSlots.stream()
                    .map(slot -> new PlannedSlot(slot, Instant.ofEpochMilli(
                        scheduleComputer.projectTime(slot, latestSlot, nowMs, slotDuration))))
                    .toList();
                ledger.recordSchedule(epoch, planned);
                reporter.schedule(planned);
            }
        }

        // Lifecycle
        PollState reconciled = reconciler.onBestHead(next.build(), best, authorities, identity);
        Optional<ChainHead> finalized = fetchFinalizedHead();
        if (finalized.isPresent()) {
            reconciled = reconciler.onFinality(reconciled, finalized.get());
        }

        return new IterationOutcome(reconciled, window, latestSlot, nextSleep(window, latestSlot, slotDuration));
    }

    /**
     * Pinned epoch: the fixed interval. Otherwise just past the estimated next
     * epoch boundary, capped at the fixed interval.
     */
    public Duration nextSleep(EpochWindow window, long latestSlot, long slotDurationMs) {
        Duration ceiling = Duration.ofSeconds(config.getWatchSeconds());
        if (config.isEpochPinned()) {
            return ceiling;
        }
        long deltaSlots = Math.max(window.nextEpochStartSlot() - latestSlot, 1);
        // deltaSlots * slotDurationMs > ceiling, without overflowing
        if (deltaSlots > ceiling.toMillis() / slotDurationMs) {
            return ceiling;
        }
        long deltaMs = deltaSlots * slotDurationMs;
        return Duration.ofSeconds(deltaMs / 1000).plus(BOUNDARY_MARGIN);
    }

    private Optional<ChainHead> fetchFinalizedHead() {
        Optional<String> hash = chainRpc.getFinalizedBlockHash();
        if (hash.isEmpty()) {
            return Optional.empty();
        }
        return chainRpc.getHeader(hash.get()).map(header -> new ChainHead(hash.get(), header));
    }
}
