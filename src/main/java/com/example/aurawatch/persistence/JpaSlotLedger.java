package com.example.aurawatch.persistence;

import com.example.aurawatch.model.EpochInfo;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.SlotObservation;
import com.example.aurawatch.model.SlotStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link SlotLedger} backed by Spring Data JPA.
 */
@Service
@ConditionalOnProperty(name = "monitor.store.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaSlotLedger implements SlotLedger {

    private final EpochInfoRepository epochRepository;
    private final SlotRecordRepository slotRepository;
    private final Clock clock;

    // ==================== Epochs ====================

    @Override
    @Transactional
    public void upsertEpoch(EpochInfo info) {
        EpochInfoEntity entity = epochRepository.findById(info.getEpoch())
            .orElseGet(() -> {
                EpochInfoEntity created = new EpochInfoEntity();
                created.setEpoch(info.getEpoch());
                created.setCreatedAt(Instant.now(clock));
                return created;
            });

        entity.setStartSlot(info.getStartSlot());
        entity.setEndSlot(info.getEndSlot());
        entity.setAuthoritySetHash(info.getAuthoritySetHash());
        entity.setAuthoritySetLen(info.getAuthoritySetLen());

        epochRepository.save(entity);
        log.debug("Upserted epoch {}: slots {}..{}, authorities={} ({})", info.getEpoch(),
                info.getStartSlot(), info.getEndSlot(), info.getAuthoritySetLen(), info.getAuthoritySetHash());
    }

    // ==================== Slots ====================

    @Override
    @Transactional
    public void recordSchedule(long epoch, List<PlannedSlot> slots) {
        int inserted = 0;
        int replanned = 0;

        for (PlannedSlot planned : slots) {
            Optional<SlotRecordEntity> existing = slotRepository.findById(planned.getSlot());
            if (existing.isEmpty()) {
                slotRepository.save(SlotRecordEntity.scheduled(planned.getSlot(), epoch, planned.getPlannedTime()));
                inserted++;
            } else if (existing.get().getStatus() == SlotStatus.SCHEDULED) {
                SlotRecordEntity entity = existing.get();
                entity.setEpoch(epoch);
                entity.setPlannedTime(planned.getPlannedTime());
                slotRepository.save(entity);
                replanned++;
            }
        }

        log.info("Persisted schedule for epoch {}: {} slots ({} new, {} re-planned)",
                epoch, slots.size(), inserted, replanned);
    }

    @Override
    public boolean markMinted(SlotObservation observation) {
        return advance(observation, SlotStatus.MINTED);
    }

    @Override
    public boolean markFinalized(SlotObservation observation) {
        return advance(observation, SlotStatus.FINALIZED);
    }

    private boolean advance(SlotObservation observation, SlotStatus target) {
        EnumSet<SlotStatus> from = EnumSet.noneOf(SlotStatus.class);
        for (SlotStatus status : SlotStatus.values()) {
            if (status.canAdvanceTo(target)) {
                from.add(status);
            }
        }
        int updated = slotRepository.advanceStatus(
            observation.getSlot(),
            observation.getBlockNumber(),
            observation.getBlockHash(),
            observation.getProducedTime(),
            target,
            from
        );
        if (updated > 0) {
            log.info("Slot {} -> {} (block #{} {})", observation.getSlot(), target.getCode(),
                    observation.getBlockNumber(), observation.getBlockHash());
        }
        return updated > 0;
    }
}
