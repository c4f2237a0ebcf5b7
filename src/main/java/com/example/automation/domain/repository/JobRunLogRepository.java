package com.example.automation.domain.repository;

import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.domain.enums.RunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobRunLog entity
 */
@Repository
public interface JobRunLogRepository extends JpaRepository<JobRunLog, UUID> {

    /**
     * Run history of one job, newest first
     */
    List<JobRunLog> findByJobNameOrderByStartedAtDesc(String jobName, Pageable pageable);

    List<JobRunLog> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<JobRunLog> findByStatusOrderByStartedAtDesc(RunStatus status, Pageable pageable);

    List<JobRunLog> findByJobNameAndStatusOrderByStartedAtDesc(String jobName, RunStatus status, Pageable pageable);

    /**
     * Entries left in a given status since before the cutoff (used for crash recovery)
     */
    List<JobRunLog> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

    /**
     * Run count and item totals per status for entries started in [start, end).
     * Rows: status, count, items processed, items created
     */
    @Query("""
            SELECT rl.status, COUNT(rl), COALESCE(SUM(rl.itemsProcessed), 0), COALESCE(SUM(rl.itemsCreated), 0)
            FROM JobRunLog rl
            WHERE rl.startedAt >= :start AND rl.startedAt < :end
            GROUP BY rl.status
            """)
    List<Object[]> summarizeByStatus(@Param("start") Instant start, @Param("end") Instant end);

    /**
     * Run count per job and status for entries started at or after the given instant.
     * Rows: job name, status, count
     */
    @Query("""
            SELECT rl.jobName, rl.status, COUNT(rl)
            FROM JobRunLog rl
            WHERE rl.startedAt >= :since
            GROUP BY rl.jobName, rl.status
            """)
    List<Object[]> countByJobAndStatusSince(@Param("since") Instant since);

    /**
     * Delete completed entries older than the cutoff.
     * Running entries are never deleted.
     */
    @Modifying
    @Transactional
    @Query("""
            DELETE FROM JobRunLog rl
            WHERE rl.startedAt < :cutoff
              AND rl.status <> com.example.automation.domain.enums.RunStatus.RUNNING
            """)
    int deleteCompletedBefore(@Param("cutoff") Instant cutoff);
}
