package com.payment.threatintel.persistence.repository;

import com.payment.threatintel.persistence.entity.ThreatSnapshotEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for per-payee threat snapshots.
 */
@Repository
public interface ThreatSnapshotRepository extends JpaRepository<ThreatSnapshotEntity, String> {

    List<ThreatSnapshotEntity> findByTotalReportsGreaterThanEqualOrderByThreatScoreDesc(long minReports, Pageable pageable);

    List<ThreatSnapshotEntity> findByReceiverIn(Collection<String> receivers);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ThreatSnapshotEntity s SET s.totalReports = s.totalReports + 1, s.lastSeen = :lastSeen WHERE s.receiver = :receiver")
    int incrementTotalReports(@Param("receiver") String receiver, @Param("lastSeen") Instant lastSeen);
}
