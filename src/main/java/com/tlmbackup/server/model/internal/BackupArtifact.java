package com.tlmbackup.server.model.internal;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * What the upload dispatcher delivers: the archive of one run plus the metadata shown to the upload target.
 */
@Value
@Builder
public class BackupArtifact {

    String runId;

    String jobName;

    String targetName;

    List<String> databases;

    Path path;

    long bytes;

    String sha256;

    Instant createdAt;

    long durationMillis;

    // 部分失败时仍会上传成功部分的 archive
    boolean partial;

    List<String> failedDatabases;

    public static BackupArtifact fromRun(JobRun jobRun, Path path) {
        List<String> dumpedDatabases = jobRun.getDatabaseResults().stream()
                .filter(DatabaseDumpResult::isSuccess)
                .map(DatabaseDumpResult::getDatabaseName)
                .toList();
        return BackupArtifact.builder()
                .runId(jobRun.getRunId())
                .jobName(jobRun.getJobName())
                .targetName(jobRun.getTargetName())
                .databases(dumpedDatabases)
                .path(path)
                .bytes(jobRun.getArtifactBytes())
                .sha256(jobRun.getSha256())
                .createdAt(jobRun.getStartedAt())
                .durationMillis(jobRun.getDurationMillis())
                .partial(!jobRun.isSuccess())
                .failedDatabases(jobRun.getFailedDatabases())
                .build();
    }
}
