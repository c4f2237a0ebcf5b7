package com.example.automation.mapper;

import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.dto.JobRunLogResponse;
import com.example.automation.dto.JobStatusResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs.
 * Runtime state and display enrichment are filled in by the calling service.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    JobStatusResponse toStatusResponse(JobConfig config);

    JobRunLogResponse toRunLogResponse(JobRunLog runLog);

    List<JobRunLogResponse> toRunLogResponses(List<JobRunLog> runLogs);
}
