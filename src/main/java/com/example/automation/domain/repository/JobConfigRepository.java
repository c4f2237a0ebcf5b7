package com.example.automation.domain.repository;

import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.enums.LastRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for JobConfig entity
 */
@Repository
public interface JobConfigRepository extends JpaRepository<JobConfig, String> {

    /**
     * All job configs in listing order
     */
    List<JobConfig> findAllByOrderByCategoryAscJobNameAsc();

    long countByEnabled(boolean enabled);

    /**
     * Count enabled jobs whose last run failed and have not recovered
     */
    long countByEnabledTrueAndLastRunStatusIn(Collection<LastRunStatus> statuses);
}
