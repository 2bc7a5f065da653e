package com.example.aurawatch.persistence;

import com.example.aurawatch.model.EpochInfo;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.SlotObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Used with {@code --monitor.store.enabled=false}: nothing is written.
 */
@Service
@ConditionalOnProperty(name = "monitor.store.enabled", havingValue = "false")
@Slf4j
public class DisabledSlotLedger implements SlotLedger {

    @Override
    public void upsertEpoch(EpochInfo info) {
        log.debug("Store disabled, not recording epoch {}", info.getEpoch());
    }

    @Override
    public void recordSchedule(long epoch, List<PlannedSlot> slots) {
        log.debug("Store disabled, not recording {} slots of epoch {}", slots.size(), epoch);
    }

    @Override
    public boolean markMinted(SlotObservation observation) {
        return false;
    }

    @Override
    public boolean markFinalized(SlotObservation observation) {
        return false;
    }
}
