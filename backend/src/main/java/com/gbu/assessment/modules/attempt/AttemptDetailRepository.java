package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AttemptDetailRepository extends JpaRepository<AttemptDetail, UUID> {

    List<AttemptDetail> findByAttemptIdOrderByPositionAsc(UUID attemptId);

    // Bulk delete runs immediately, ahead of the replacement inserts
    @Modifying(flushAutomatically = true, clearAutomatically = false)
    @Query("DELETE FROM AttemptDetail d WHERE d.attemptId = :attemptId")
    int deleteByAttemptId(@Param("attemptId") UUID attemptId);

    @Query("SELECT d.category AS category, " +
            "SUM(CASE WHEN d.isCorrect = true THEN 1 ELSE 0 END) AS correct, " +
            "COUNT(d) AS total " +
            "FROM AttemptDetail d, AptitudeAttempt a " +
            "WHERE d.attemptId = a.id AND a.userId = :userId AND d.category IS NOT NULL " +
            "GROUP BY d.category ORDER BY d.category")
    List<TopicStats> findTopicStats(@Param("userId") UUID userId);

    interface TopicStats {
        AptitudeCategory getCategory();

        Long getCorrect();

        Long getTotal();
    }
}
