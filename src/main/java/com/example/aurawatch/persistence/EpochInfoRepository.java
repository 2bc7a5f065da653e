package com.example.aurawatch.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for epoch metadata, keyed by epoch index.
 */
@Repository
public interface EpochInfoRepository extends JpaRepository<EpochInfoEntity, Long> {
}
