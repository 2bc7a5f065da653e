package com.example.aurawatch.persistence;

import com.example.aurawatch.model.SlotStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;

/**
 * Repository for per-slot lifecycle rows, keyed by slot.
 */
@Repository
public interface SlotRecordRepository extends JpaRepository<SlotRecordEntity, Long> {

    /**
     * Moves a slot to {@code target} only if its current status is one of {@code from}.
     * Returns the number of rows changed (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE SlotRecordEntity b SET b.blockNumber = :blockNumber, b.blockHash = :blockHash, "
        + "b.producedTime = :producedTime, b.status = :target "
        + "WHERE b.slot = :slot AND b.status IN :from")
    int advanceStatus(@Param("slot") long slot,
                      @Param("blockNumber") long blockNumber,
                      @Param("blockHash") String blockHash,
                      @Param("producedTime") Instant producedTime,
                      @Param("target") SlotStatus target,
                      @Param("from") Collection<SlotStatus> from);
}
