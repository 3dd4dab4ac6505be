package tech.compendium.sdk.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import tech.compendium.sdk.enums.StageStatus;

import java.time.Instant;

/**
 * One stage of a job.
 */
@Builder(toBuilder = true)
public record JobStage(
    int stage,
    String name,
    StageStatus status,
    @JsonAlias("start_time") Instant startTime,
    @JsonAlias("end_time") Instant endTime,
    String error
) {}
