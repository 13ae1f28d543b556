package com.tlmbackup.server.service.executor;

import com.tlmbackup.server.FakeDatabaseDumper;
import com.tlmbackup.server.MutableClock;
import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.EventLevelEnum;
import com.tlmbackup.server.enums.FailureTypeEnum;
import com.tlmbackup.server.enums.RunStatusEnum;
import com.tlmbackup.server.enums.ScheduleUnitEnum;
import com.tlmbackup.server.enums.TriggerTypeEnum;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.config.Schedule;
import com.tlmbackup.server.model.internal.BackupArtifact;
import com.tlmbackup.server.model.internal.DatabaseDumpResult;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.service.dump.DatabaseDumperRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static com.tlmbackup.server.BackupTestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

class JobExecutorTest {

    @TempDir
    Path backupDirectory;

    private final MutableClock clock = new MutableClock(T0);

    private final FakeDatabaseDumper dumper = new FakeDatabaseDumper();

    private EventBroadcaster eventBroadcaster;

    private JobExecutor jobExecutor;

    private final JobSpec jobSpec = job("trio", ScheduleUnitEnum.HOURS, 6, "app", "crm", "erp");

    @BeforeEach
    void setUp() {
        BackupSettings backupSettings = settings(this.backupDirectory, this.jobSpec);
        backupSettings.getEvents().setReplayBufferSize(50);
        this.eventBroadcaster = new EventBroadcaster(backupSettings, this.clock);
        this.jobExecutor = new JobExecutor(
                new DatabaseDumperRegistry(List.of(this.dumper)), this.eventBroadcaster, backupSettings, this.clock);
    }

    private static List<String> zipEntries(String zipPath) throws IOException {
        List<String> entries = new ArrayList<>();
        try (ZipFile zipFile = new ZipFile(zipPath)) {
            zipFile.stream().map(ZipEntry::getName).forEach(entries::add);
        }
        return entries;
    }

    @Test
    void allDatabasesDumpedGivesOneArchive() throws IOException {
        JobRun jobRun = this.jobExecutor.execute(
                this.jobSpec, TriggerTypeEnum.SCHEDULED, "1f2e3d4c-0000-4000-8000-000000000001", T0);

        assertEquals(RunStatusEnum.SUCCESS, jobRun.getStatus());
        assertNull(jobRun.getFailureType());
        Path archive = Paths.get(jobRun.getArtifactPath());
        assertEquals(this.backupDirectory.resolve(TARGET).resolve("trio")
                .resolve("backup_local_20260301_120000_1f2e3d4c.zip"), archive);
        assertEquals(Files.size(archive), jobRun.getArtifactBytes());
        assertEquals(64, jobRun.getSha256().length());
        assertEquals(List.of("app_20260301_120000.sql", "crm_20260301_120000.sql", "erp_20260301_120000.sql"),
                zipEntries(jobRun.getArtifactPath()));
        // 中间 sql 文件和 staging 目录已删除
        try (Stream<Path> files = Files.list(this.backupDirectory.resolve(TARGET).resolve("trio"))) {
            assertEquals(List.of(archive), files.toList());
        }
        assertEquals(3, jobRun.getDatabaseResults().size());
        assertTrue(jobRun.getDatabaseResults().stream().allMatch(DatabaseDumpResult::isSuccess));
    }

    @Test
    void jobsOnSameTargetStartedTogetherKeepSeparateArchives() throws IOException {
        JobSpec alpha = job("alpha", ScheduleUnitEnum.HOURS, 6, "app");
        JobSpec beta = job("beta", ScheduleUnitEnum.HOURS, 6, "crm");

        JobRun alphaRun = this.jobExecutor.execute(alpha, TriggerTypeEnum.SCHEDULED, "aaaaaaaa-run", T0);
        JobRun betaRun = this.jobExecutor.execute(beta, TriggerTypeEnum.SCHEDULED, "bbbbbbbb-run", T0);

        assertEquals(RunStatusEnum.SUCCESS, alphaRun.getStatus());
        assertEquals(RunStatusEnum.SUCCESS, betaRun.getStatus());
        assertNotEquals(alphaRun.getArtifactPath(), betaRun.getArtifactPath());
        assertEquals(List.of("app_20260301_120000.sql"), zipEntries(alphaRun.getArtifactPath()));
        assertEquals(List.of("crm_20260301_120000.sql"), zipEntries(betaRun.getArtifactPath()));
    }

    @Test
    void sameJobRunTwiceWithinOneSecondKeepsBothArchives() {
        JobRun first = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.SCHEDULED, "11111111-run", T0);
        JobRun second = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.MANUAL, "22222222-run", T0);

        assertNotEquals(first.getArtifactPath(), second.getArtifactPath());
        assertTrue(Files.exists(Paths.get(first.getArtifactPath())));
        assertTrue(Files.exists(Paths.get(second.getArtifactPath())));
    }

    @Test
    void derivedJobNameIsSafeAsFolderName() {
        JobSpec unnamed = job(null, ScheduleUnitEnum.HOURS, 6, "app", "crm");

        JobRun jobRun = this.jobExecutor.execute(unnamed, TriggerTypeEnum.MANUAL, "33333333-run", T0);

        assertEquals(RunStatusEnum.SUCCESS, jobRun.getStatus());
        assertEquals(this.backupDirectory.resolve(TARGET).resolve("local_app_crm"),
                Paths.get(jobRun.getArtifactPath()).getParent());
    }

    @Test
    void oneFailedDatabaseGivesPartialFailureWithArchiveOfTheRest() throws IOException {
        this.dumper.failDump("crm");

        JobRun jobRun = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.MANUAL);

        assertEquals(RunStatusEnum.FAILED, jobRun.getStatus());
        assertEquals(FailureTypeEnum.PARTIAL_JOB_FAILURE, jobRun.getFailureType());
        assertEquals(List.of("crm"), jobRun.getFailedDatabases());
        assertTrue(jobRun.getErrorSummary().contains("crm"));
        assertTrue(jobRun.hasArtifact());
        assertEquals(List.of("app_20260301_120000.sql", "erp_20260301_120000.sql"),
                zipEntries(jobRun.getArtifactPath()));
        // 其他 database 仍然 dump
        assertEquals(List.of("app", "erp"), this.dumper.getDumped());

        BackupArtifact artifact = BackupArtifact.fromRun(jobRun, Paths.get(jobRun.getArtifactPath()));
        assertTrue(artifact.isPartial());
        assertEquals(List.of("app", "erp"), artifact.getDatabases());
        assertEquals(List.of("crm"), artifact.getFailedDatabases());
    }

    @Test
    void everyDatabaseUnreachableGivesConnectionError() {
        this.dumper.failConnection("app");
        this.dumper.failConnection("crm");
        this.dumper.failConnection("erp");

        JobRun jobRun = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.SCHEDULED);

        assertEquals(FailureTypeEnum.CONNECTION_ERROR, jobRun.getFailureType());
        assertFalse(jobRun.hasArtifact());
        assertEquals(0L, jobRun.getArtifactBytes());
        assertEquals(List.of("app", "crm", "erp"), jobRun.getFailedDatabases());
        assertTrue(jobRun.getErrorSummary().startsWith("All databases failed"));
        assertEquals(3, this.dumper.getCalls());
    }

    @Test
    void mixedTotalFailureGivesDumpError() {
        this.dumper.failConnection("app");
        this.dumper.failDump("crm");
        this.dumper.failDump("erp");

        JobRun jobRun = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.SCHEDULED);

        assertEquals(FailureTypeEnum.DUMP_ERROR, jobRun.getFailureType());
        assertEquals(FailureTypeEnum.CONNECTION_ERROR, jobRun.getDatabaseResults().get(0).getFailureType());
        assertEquals(3, this.eventBroadcaster.recent().stream()
                .filter(e -> e.getLevel() == EventLevelEnum.ERROR)
                .count());
    }

    @Test
    void unknownTargetFailsWithoutDumping() {
        JobSpec orphan = new JobSpec("orphan", "nowhere", List.of("app"), Schedule.every(ScheduleUnitEnum.HOURS, 1));

        JobRun jobRun = this.jobExecutor.execute(orphan, TriggerTypeEnum.MANUAL);

        assertEquals(RunStatusEnum.FAILED, jobRun.getStatus());
        assertEquals(FailureTypeEnum.INTERNAL_ERROR, jobRun.getFailureType());
        assertTrue(jobRun.getErrorSummary().startsWith("Failed to prepare backup"));
        assertEquals(0, this.dumper.getCalls());
    }

    @Test
    void interruptedRunSkipsRemainingDatabases() {
        Thread.currentThread().interrupt();
        try {
            JobRun jobRun = this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.SCHEDULED);

            assertEquals(0, this.dumper.getCalls());
            assertEquals(RunStatusEnum.FAILED, jobRun.getStatus());
            assertTrue(jobRun.getDatabaseResults().stream()
                    .allMatch(r -> r.getFailureType() == FailureTypeEnum.TIMEOUT));
        } finally {
            // 清除中断标志
            Thread.interrupted();
        }
    }

    @Test
    void progressIsPublishedUnderJobOrigin() {
        this.jobExecutor.execute(this.jobSpec, TriggerTypeEnum.SCHEDULED);

        List<String> messages = this.eventBroadcaster.recent().stream()
                .filter(e -> e.getOrigin().equals("job:trio"))
                .map(e -> e.getMessage())
                .toList();
        assertEquals("Starting backup of 3 database(s) on local", messages.get(0));
        assertTrue(messages.get(1).startsWith("Dumped app ("));
        assertEquals(4, messages.size());
    }
}
