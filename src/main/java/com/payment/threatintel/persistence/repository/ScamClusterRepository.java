package com.payment.threatintel.persistence.repository;

import com.payment.threatintel.persistence.entity.ScamClusterEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for cluster rows of every retained generation.
 */
@Repository
public interface ScamClusterRepository extends JpaRepository<ScamClusterEntity, String> {

    List<ScamClusterEntity> findByGeneration(long generation);

    List<ScamClusterEntity> findByGenerationOrderByAvgScoreDesc(long generation, Pageable pageable);

    List<ScamClusterEntity> findByGenerationAndActiveTrueOrderByAvgScoreDesc(long generation, Pageable pageable);

    List<ScamClusterEntity> findByGenerationAndActiveTrue(long generation);

    @Modifying
    @Query("DELETE FROM ScamClusterEntity c WHERE c.generation < :generation")
    int deleteGenerationsBefore(@Param("generation") long generation);
}
