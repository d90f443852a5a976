package com.payment.threatintel.persistence.repository;

import com.payment.threatintel.persistence.entity.ThreatEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the scam report log.
 */
@Repository
public interface ThreatEventRepository extends JpaRepository<ThreatEventEntity, String> {

    List<ThreatEventEntity> findByReceiverOrderByTimestampDesc(String receiver, Pageable pageable);

    List<ThreatEventEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
