package com.tlmbackup.server.service.executor;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.FailureTypeEnum;
import com.tlmbackup.server.enums.RunStatusEnum;
import com.tlmbackup.server.enums.TriggerTypeEnum;
import com.tlmbackup.server.exception.ConnectionException;
import com.tlmbackup.server.exception.DumpException;
import com.tlmbackup.server.exception.TlmBackupException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.DatabaseTarget;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.internal.DatabaseDumpResult;
import com.tlmbackup.server.model.internal.DumpArtifact;
import com.tlmbackup.server.model.internal.EventOrigin;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.service.dump.DatabaseDumper;
import com.tlmbackup.server.service.dump.DatabaseDumperRegistry;
import com.tlmbackup.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one job: dumps every database of the job one after another, packs the successful
 * dumps into a single ZIP archive and hashes it.
 * <p>
 * A failing database never aborts the others. The run succeeds only when every database
 * succeeded; otherwise it fails and names the failed databases, keeping the archive of
 * the ones that worked. Nothing is retried here.
 */
@Slf4j
@Service
public class JobExecutor {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final int RUN_TAG_LENGTH = 8;

    private final DatabaseDumperRegistry databaseDumperRegistry;

    private final EventBroadcaster eventBroadcaster;

    private final BackupSettings backupSettings;

    private final Clock clock;

    @Autowired
    public JobExecutor(
            DatabaseDumperRegistry databaseDumperRegistry,
            EventBroadcaster eventBroadcaster,
            BackupSettings backupSettings,
            Clock clock) {
        this.databaseDumperRegistry = databaseDumperRegistry;
        this.eventBroadcaster = eventBroadcaster;
        this.backupSettings = backupSettings;
        this.clock = clock;
    }

    public JobRun execute(JobSpec jobSpec, TriggerTypeEnum trigger) {
        return this.execute(jobSpec, trigger, UUID.randomUUID().toString(), this.clock.instant());
    }

    public JobRun execute(JobSpec jobSpec, TriggerTypeEnum trigger, String runId, Instant startedAt) {
        String origin = EventOrigin.job(jobSpec.getName());
        JobRun.JobRunBuilder builder = JobRun.builder()
                .runId(runId)
                .jobName(jobSpec.getName())
                .targetName(jobSpec.getTarget())
                .trigger(trigger)
                .startedAt(startedAt);
        // 1. 准备 target 和备份目录
        DatabaseTarget target;
        DatabaseDumper databaseDumper;
        String runTag = toRunTag(runId);
        Path jobFolder;
        Path stagingFolder;
        try {
            target = this.backupSettings.getTarget(jobSpec.getTarget());
            databaseDumper = this.databaseDumperRegistry.getDumper(target.getEngine());
            // <backupDirectory>/<target>/<job>/, 每次 run 的 sql 先写入独立的 staging 目录
            jobFolder = FilesystemUtil.ensureFolder(Paths.get(this.backupSettings.getBackupDirectory())
                    .resolve(FilesystemUtil.toFileNamePart(target.getName()))
                    .resolve(FilesystemUtil.toFileNamePart(jobSpec.getName())));
            stagingFolder = FilesystemUtil.ensureFolder(jobFolder.resolve(".run_" + runTag));
        } catch (TlmBackupException e) {
            log.error("execute failed. job {} could not be prepared.", jobSpec.getName(), e);
            return this.failed(builder, FailureTypeEnum.INTERNAL_ERROR,
                    "Failed to prepare backup: " + e.getMessage());
        }
        String timestamp = FILE_TIMESTAMP.format(startedAt.atZone(this.clock.getZone()));
        try {
            return this.dumpAndArchive(
                    builder, jobSpec, target, databaseDumper, jobFolder, stagingFolder, timestamp, runTag, origin);
        } finally {
            FilesystemUtil.deleteQuietly(stagingFolder);
        }
    }

    private JobRun dumpAndArchive(
            JobRun.JobRunBuilder builder,
            JobSpec jobSpec,
            DatabaseTarget target,
            DatabaseDumper databaseDumper,
            Path jobFolder,
            Path stagingFolder,
            String timestamp,
            String runTag,
            String origin) {
        this.eventBroadcaster.info(origin, "Starting backup of %d database(s) on %s"
                .formatted(jobSpec.getDatabases().size(), target.getName()));
        // 2. 逐个 dump, 单个失败不影响其他
        List<DumpArtifact> dumpArtifacts = new ArrayList<>();
        List<DatabaseDumpResult> failures = new ArrayList<>();
        for (String databaseName : jobSpec.getDatabases()) {
            if (Thread.currentThread().isInterrupted()) {
                // 超时被中断, 剩余的 database 不再 dump
                DatabaseDumpResult skipped = DatabaseDumpResult.failed(
                        databaseName, 0L, FailureTypeEnum.TIMEOUT, "run interrupted before dump");
                builder.databaseResult(skipped);
                failures.add(skipped);
                continue;
            }
            DatabaseDumpResult result = this.dumpOne(
                    databaseDumper, target, databaseName, stagingFolder, timestamp, origin, dumpArtifacts);
            builder.databaseResult(result);
            if (!result.isSuccess()) {
                failures.add(result);
            }
        }
        if (dumpArtifacts.isEmpty()) {
            FailureTypeEnum failureType = allOf(failures, FailureTypeEnum.CONNECTION_ERROR) ?
                    FailureTypeEnum.CONNECTION_ERROR :
                    FailureTypeEnum.DUMP_ERROR;
            builder.failedDatabases(failures.stream().map(DatabaseDumpResult::getDatabaseName).toList());
            return this.failed(builder, failureType, "All databases failed: " + summarize(failures));
        }
        // 3. 打包成功的 dump, 删除中间文件
        // run tag 区分同一秒内的多次 run
        Path zipFile = jobFolder.resolve("backup_%s_%s_%s.zip"
                .formatted(FilesystemUtil.toFileNamePart(target.getName()), timestamp, runTag));
        List<Path> sqlFiles = dumpArtifacts.stream().map(DumpArtifact::getPath).toList();
        try {
            FilesystemUtil.zipFiles(sqlFiles, zipFile);
        } catch (TlmBackupException e) {
            log.error("execute failed. archive {} could not be written.", zipFile, e);
            sqlFiles.forEach(FilesystemUtil::deleteQuietly);
            builder.failedDatabases(failures.stream().map(DatabaseDumpResult::getDatabaseName).toList());
            return this.failed(builder, FailureTypeEnum.INTERNAL_ERROR,
                    "Failed to create archive: " + e.getMessage());
        }
        sqlFiles.forEach(FilesystemUtil::deleteQuietly);
        long archiveBytes = FilesystemUtil.size(zipFile);
        String sha256 = null;
        try {
            sha256 = FilesystemUtil.sha256(zipFile);
        } catch (TlmBackupException e) {
            log.warn("execute. sha256 of {} could not be computed.", zipFile, e);
        }
        builder.artifactPath(zipFile.toString())
                .artifactBytes(archiveBytes)
                .sha256(sha256);
        // 4. 汇总结果
        if (failures.isEmpty()) {
            return builder
                    .status(RunStatusEnum.SUCCESS)
                    .finishedAt(this.clock.instant())
                    .build();
        }
        List<String> failedDatabases = failures.stream().map(DatabaseDumpResult::getDatabaseName).toList();
        return builder
                .status(RunStatusEnum.FAILED)
                .failureType(FailureTypeEnum.PARTIAL_JOB_FAILURE)
                .failedDatabases(failedDatabases)
                .errorSummary("Partial failure, failed databases %s: %s"
                        .formatted(failedDatabases, summarize(failures)))
                .finishedAt(this.clock.instant())
                .build();
    }

    private DatabaseDumpResult dumpOne(
            DatabaseDumper databaseDumper,
            DatabaseTarget target,
            String databaseName,
            Path stagingFolder,
            String timestamp,
            String origin,
            List<DumpArtifact> dumpArtifacts) {
        Path sqlFile = stagingFolder.resolve("%s_%s.sql".formatted(databaseName, timestamp));
        Instant dumpStartedAt = this.clock.instant();
        try {
            DumpArtifact dumpArtifact = databaseDumper.dump(target, databaseName, sqlFile);
            dumpArtifacts.add(dumpArtifact);
            long elapsed = this.elapsedMillis(dumpStartedAt);
            this.eventBroadcaster.info(origin, "Dumped %s (%s)"
                    .formatted(databaseName, FilesystemUtil.formatMegabytes(dumpArtifact.getBytes())));
            return DatabaseDumpResult.success(databaseName, dumpArtifact.getBytes(), elapsed);
        } catch (ConnectionException e) {
            return this.dumpFailed(databaseName, sqlFile, dumpStartedAt, FailureTypeEnum.CONNECTION_ERROR, e, origin);
        } catch (DumpException e) {
            return this.dumpFailed(databaseName, sqlFile, dumpStartedAt, FailureTypeEnum.DUMP_ERROR, e, origin);
        } catch (RuntimeException e) {
            return this.dumpFailed(databaseName, sqlFile, dumpStartedAt, FailureTypeEnum.INTERNAL_ERROR, e, origin);
        }
    }

    private DatabaseDumpResult dumpFailed(
            String databaseName,
            Path sqlFile,
            Instant dumpStartedAt,
            FailureTypeEnum failureType,
            Exception e,
            String origin) {
        log.error("dump failed. database is {}, failure type is {}", databaseName, failureType, e);
        FilesystemUtil.deleteQuietly(sqlFile);
        this.eventBroadcaster.error(origin, "Failed to dump %s: %s".formatted(databaseName, e.getMessage()));
        return DatabaseDumpResult.failed(databaseName, this.elapsedMillis(dumpStartedAt), failureType, e.getMessage());
    }

    private JobRun failed(JobRun.JobRunBuilder builder, FailureTypeEnum failureType, String summary) {
        return builder
                .status(RunStatusEnum.FAILED)
                .failureType(failureType)
                .errorSummary(summary)
                .finishedAt(this.clock.instant())
                .build();
    }

    private long elapsedMillis(Instant from) {
        return Duration.between(from, this.clock.instant()).toMillis();
    }

    private static String toRunTag(String runId) {
        String runTag = FilesystemUtil.toFileNamePart(runId).replace("-", "");
        return runTag.length() > RUN_TAG_LENGTH ? runTag.substring(0, RUN_TAG_LENGTH) : runTag;
    }

    private static boolean allOf(List<DatabaseDumpResult> failures, FailureTypeEnum failureType) {
        return !failures.isEmpty() && failures.stream().allMatch(f -> f.getFailureType() == failureType);
    }

    private static String summarize(List<DatabaseDumpResult> failures) {
        return failures.stream()
                .map(f -> "%s (%s)".formatted(f.getDatabaseName(), f.getError()))
                .collect(Collectors.joining("; "));
    }
}
