package com.tlmbackup.server.model.internal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tlmbackup.server.enums.FailureTypeEnum;
import com.tlmbackup.server.enums.RunStatusEnum;
import com.tlmbackup.server.enums.TriggerTypeEnum;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One finalized execution of a job. Immutable once built.
 * <p>
 * {@code artifactPath}, {@code artifactBytes} and {@code sha256} are set whenever an archive
 * was written, which includes a partial failure.
 */
@Value
@Builder(toBuilder = true)
public class JobRun {

    String runId;

    String jobName;

    String targetName;

    TriggerTypeEnum trigger;

    Instant startedAt;

    Instant finishedAt;

    RunStatusEnum status;

    String artifactPath;

    long artifactBytes;

    String sha256;

    @Singular
    List<DatabaseDumpResult> databaseResults;

    FailureTypeEnum failureType;

    String errorSummary;

    @Singular
    List<String> failedDatabases;

    public long getDurationMillis() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == RunStatusEnum.SUCCESS;
    }

    @JsonIgnore
    public boolean hasArtifact() {
        return artifactPath != null;
    }
}
