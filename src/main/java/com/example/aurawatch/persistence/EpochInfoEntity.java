package com.example.aurawatch.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per observed epoch, rewritten whenever the epoch is seen with a
 * (possibly) different authority set.
 */
@Entity
@Table(name = "epoch_info")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EpochInfoEntity {

    @Id
    private Long epoch;

    @Column(nullable = false)
    private long startSlot;

    @Column(nullable = false)
    private long endSlot;

    /**
     * Hex SHA-256 over the ordered authority keys.
     */
    @Column(nullable = false, length = 66)
    private String authoritySetHash;

    @Column(nullable = false)
    private int authoritySetLen;

    /**
     * First time the epoch was recorded; later upserts keep it.
     */
    @Column(nullable = false)
    private Instant createdAt;
}
