package com.example.aurawatch.persistence;

import com.example.aurawatch.model.SlotStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lifecycle row for one of our slots. Created as {@code schedule}, moved
 * forward in place, never deleted.
 */
@Entity
@Table(name = "blocks", indexes = {
    @Index(name = "idx_blocks_epoch", columnList = "epoch")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotRecordEntity {

    @Id
    private Long slot;

    @Column(nullable = false)
    private long epoch;

    @Column(nullable = false)
    private Instant plannedTime;

    @Column
    private Long blockNumber;

    @Column(length = 66)
    private String blockHash;

    @Column
    private Instant producedTime;

    @Column(nullable = false, length = 16)
    private SlotStatus status;

    public static SlotRecordEntity scheduled(long slot, long epoch, Instant plannedTime) {
        return new SlotRecordEntity(slot, epoch, plannedTime, null, null, null, SlotStatus.SCHEDULED);
    }
}
