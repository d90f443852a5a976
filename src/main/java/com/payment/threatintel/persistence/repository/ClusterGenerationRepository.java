package com.payment.threatintel.persistence.repository;

import com.payment.threatintel.persistence.entity.ClusterGenerationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClusterGenerationRepository extends JpaRepository<ClusterGenerationEntity, String> {
}
