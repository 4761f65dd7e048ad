package com.gbu.assessment.modules.attempt;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AptitudeAttemptRepository extends JpaRepository<AptitudeAttempt, UUID> {

    // Row lock for every state change: autosave, submit, discard and expiry
    // all serialize on the attempt row
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AptitudeAttempt a WHERE a.id = :id")
    Optional<AptitudeAttempt> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AptitudeAttempt a WHERE a.activeOwnerId = :userId")
    Optional<AptitudeAttempt> findActiveForUpdate(@Param("userId") UUID userId);

    // Anti-repetition window, newest first
    List<AptitudeAttempt> findByUserIdOrderByStartedAtDesc(UUID userId, Pageable pageable);

    List<AptitudeAttempt> findByUserIdAndStatusOrderByCompletedAtDesc(UUID userId, AttemptStatus status,
            Pageable pageable);

    Page<AptitudeAttempt> findByUserId(UUID userId, Pageable pageable);

    @Query("SELECT COUNT(a) AS totalAttempts, AVG(a.score) AS averageScore, MAX(a.score) AS bestScore " +
            "FROM AptitudeAttempt a WHERE a.userId = :userId " +
            "AND a.status = com.gbu.assessment.modules.attempt.AttemptStatus.COMPLETED")
    AttemptStats findCompletedStats(@Param("userId") UUID userId);

    interface AttemptStats {
        long getTotalAttempts();

        Double getAverageScore();

        BigDecimal getBestScore();
    }
}
