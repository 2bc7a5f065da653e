package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.TransportException;
import com.example.aurawatch.model.EpochInfo;
import com.example.aurawatch.model.EpochWindow;
import com.example.aurawatch.model.IterationOutcome;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.PollState;
import com.example.aurawatch.model.ValidatorIdentity;
import com.example.aurawatch.persistence.SlotLedger;
import com.example.aurawatch.rpc.ScriptedChainRpc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.example.aurawatch.TestKeys.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PollScheduler.
 * Runs iterations against a scripted chain with a mocked ledger.
 */
@ExtendWith(MockitoExtension.class)
class PollSchedulerTest {

    @Mock
    private SlotLedger ledger;

    private MonitorConfig config;
    private ScriptedChainRpc chain;
    private ByteArrayOutputStream output;
    private List<Duration> sleeps;
    private PollScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new MonitorConfig();
        config.setKeystorePath("/data/keystore");
        config.setEpochSize(6);
        config.setWatchSeconds(30);

        chain = new ScriptedChainRpc();
        chain.authorities = set(A, B, C);
        chain.slotDuration = 6000;
        chain.timestamp = 12_000L;
        chain.bestHash = chain.addBlock(2, 2L);

        output = new ByteArrayOutputStream();
        sleeps = new ArrayList<>();
        ScheduleComputer computer = new ScheduleComputer();
        LifecycleReconciler reconciler = new LifecycleReconciler(chain, ledger, computer,
            Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        ScheduleReporter reporter = new ScheduleReporter(
            new PrintStream(output, true, StandardCharsets.UTF_8), ZoneOffset.UTC, false);

        scheduler = new PollScheduler(config, chain, new AuthoritySetTracker(chain), computer,
            reconciler, ledger, reporter, sleeps::add);
    }

    @Test
    void testFirstIterationRecordsSchedule() {
        IterationOutcome outcome = scheduler.runIteration(identity(B), PollState.initial(0));

        verify(ledger).recordSchedule(0, List.of(
            new PlannedSlot(1, Instant.ofEpochMilli(6_000)),
            new PlannedSlot(4, Instant.ofEpochMilli(24_000))
        ));
        ArgumentCaptor<EpochInfo> epoch = ArgumentCaptor.forClass(EpochInfo.class);
        verify(ledger).upsertEpoch(epoch.capture());
        assertEquals(0, epoch.getValue().getEpoch());
        assertEquals(0, epoch.getValue().getStartSlot());
        assertEquals(5, epoch.getValue().getEndSlot());
        assertEquals(3, epoch.getValue().getAuthoritySetLen());

        assertEquals(2, outcome.getLatestSlot());
        assertEquals(Duration.ofSeconds(25), outcome.getSleep());
        assertEquals(0L, outcome.getNextState().getEpoch());
        assertTrue(outcome.getNextState().isIdentityReported());

        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("epoch=0 / start_slot=0 / end_slot=5"));
        assertTrue(printed.contains("author=" + B.toHex()));
        assertTrue(printed.contains("slot 1: 1970-01-01T00:00:06Z (UTC 1970-01-01T00:00:06Z)"));
        assertTrue(printed.contains("slot 4: 1970-01-01T00:00:24Z"));
    }

    @Test
    void testUnchangedIterationWritesNothing() {
        PollState state = scheduler.runIteration(identity(B), PollState.initial(0)).getNextState();
        output.reset();

        scheduler.runIteration(identity(B), state);

        verify(ledger, times(1)).upsertEpoch(any());
        verify(ledger, times(1)).recordSchedule(anyLong(), any());
        assertEquals("", output.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testAuthoritySetChangeRecomputesSchedule() {
        PollState state = scheduler.runIteration(identity(B), PollState.initial(0)).getNextState();
        chain.authorities = set(A, B);

        scheduler.runIteration(identity(B), state);

        verify(ledger, times(2)).upsertEpoch(any());
        verify(ledger).recordSchedule(eq(0L), argThat(slots ->
            slots.stream().map(PlannedSlot::getSlot).toList().equals(List.of(1L, 3L, 5L))));
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("authority set changed (len 3 -> 2)"));
    }

    @Test
    void testNotAnAuthoritySkipsSchedule() {
        chain.authorities = set(A, C);

        IterationOutcome outcome = scheduler.runIteration(identity(B), PollState.initial(0));

        verify(ledger).upsertEpoch(any());
        verify(ledger, never()).recordSchedule(anyLong(), any());
        assertFalse(outcome.getNextState().getAuthorPresent());
    }

    @Test
    void testMintedOwnSlotAtBestHead() {
        chain.bestHash = chain.addBlock(5, 4L);

        scheduler.runIteration(identity(B), PollState.initial(0));

        verify(ledger).markMinted(argThat(o -> o.getSlot() == 4 && o.getBlockNumber() == 5));
    }

    @Test
    void testFinalityScanFromStartMarker() {
        chain.addBlock(1, 1L);
        chain.finalizedHash = chain.addBlock(2, 2L);

        IterationOutcome outcome = scheduler.runIteration(identity(B), PollState.initial(0));

        verify(ledger).markFinalized(argThat(o -> o.getSlot() == 1));
        verify(ledger).markFinalized(argThat(o -> o.getSlot() == 2));
        assertEquals(2, outcome.getNextState().getLastFinalizedNumber());
    }

    @Test
    void testSlotFallsBackToTimestamp() {
        chain.bestHash = chain.addBlock(9, null);
        chain.timestamp = 6_000L * 13;

        IterationOutcome outcome = scheduler.runIteration(identity(B), PollState.initial(0));

        assertEquals(13, outcome.getLatestSlot());
        assertEquals(2, outcome.getWindow().getEpoch());
    }

    @Test
    void testPinnedEpoch() {
        config.setEpoch(7L);

        IterationOutcome outcome = scheduler.runIteration(identity(B), PollState.initial(0));

        assertEquals(7, outcome.getWindow().getEpoch());
        assertEquals(42, outcome.getWindow().getStartSlot());
        assertEquals(Duration.ofSeconds(30), outcome.getSleep());
    }

    @Test
    void testNonPositiveSlotDurationIsFatal() {
        chain.slotDuration = 0;

        TransportException e = assertThrows(TransportException.class,
            () -> scheduler.runIteration(identity(B), PollState.initial(0)));
        assertEquals(ErrorCode.RPC_MALFORMED_RESULT, e.getErrorCode());
    }

    @Test
    void testMissingBestHeadIsFatal() {
        chain.bestHash = null;

        TransportException e = assertThrows(TransportException.class,
            () -> scheduler.runIteration(identity(B), PollState.initial(0)));
        assertEquals(ErrorCode.MISSING_CHAIN_DATA, e.getErrorCode());
        verify(ledger, never()).recordSchedule(anyLong(), any());
    }

    @Test
    void testNextSleep() {
        EpochWindow epoch0 = EpochWindow.frame(0, 6, 6);

        assertEquals(Duration.ofSeconds(25), scheduler.nextSleep(epoch0, 2, 6000));
        assertEquals(Duration.ofSeconds(7), scheduler.nextSleep(epoch0, 9, 6000));
        assertEquals(Duration.ofSeconds(30), scheduler.nextSleep(EpochWindow.frame(0, 1200, 1200), 2, 6000));
        assertEquals(Duration.ofSeconds(1), scheduler.nextSleep(epoch0, 5, 500));

        config.setEpoch(0L);
        assertEquals(Duration.ofSeconds(30), scheduler.nextSleep(epoch0, 2, 6000));
    }

    @Test
    void testOneShotRunsOnce() {
        scheduler.run(identity(B));

        verify(ledger, times(1)).upsertEpoch(any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testWatchModeStopsOnInterrupt() {
        config.setWatch(true);
        List<Duration> slept = new ArrayList<>();
        ValidatorIdentity identity = identity(B);
        PollScheduler interrupting = new PollScheduler(config, chain, new AuthoritySetTracker(chain),
            new ScheduleComputer(), new LifecycleReconciler(chain, ledger, new ScheduleComputer(), Clock.systemUTC()),
            ledger, new ScheduleReporter(new PrintStream(output, true, StandardCharsets.UTF_8), ZoneOffset.UTC, false),
            duration -> {
                slept.add(duration);
                if (slept.size() == 2) {
                    throw new InterruptedException();
                }
            });

        PollState last = interrupting.run(identity);

        assertTrue(Thread.interrupted());
        assertEquals(List.of(Duration.ofSeconds(25), Duration.ofSeconds(25)), slept);
        assertEquals(0L, last.getEpoch());
        verify(ledger, times(1)).recordSchedule(anyLong(), any());
    }
}
