package com.tlmbackup.server.service.status;

import com.tlmbackup.server.MutableClock;
import com.tlmbackup.server.enums.FailureTypeEnum;
import com.tlmbackup.server.enums.RunStatusEnum;
import com.tlmbackup.server.enums.ScheduleUnitEnum;
import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.enums.TriggerTypeEnum;
import com.tlmbackup.server.enums.UploadStatusEnum;
import com.tlmbackup.server.exception.ResourceNotFoundException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.api.status.JobStatus;
import com.tlmbackup.server.model.api.status.StatusSnapshot;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.model.internal.UploadRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.tlmbackup.server.BackupTestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

class StatusStoreTest {

    @TempDir
    Path backupDirectory;

    private final MutableClock clock = new MutableClock(T0);

    private StatusStore statusStore;

    @BeforeEach
    void setUp() {
        BackupSettings backupSettings = settings(this.backupDirectory,
                job("alpha", ScheduleUnitEnum.HOURS, 6, "app"),
                job("beta", ScheduleUnitEnum.DAYS, 1, "crm", "erp"));
        this.statusStore = new StatusStore(backupSettings, this.clock);
    }

    private static JobRun run(String jobName, RunStatusEnum status, long bytes) {
        JobRun.JobRunBuilder builder = JobRun.builder()
                .runId(UUID.randomUUID().toString())
                .jobName(jobName)
                .targetName(TARGET)
                .trigger(TriggerTypeEnum.SCHEDULED)
                .startedAt(T0)
                .finishedAt(T0.plusSeconds(3))
                .status(status);
        if (bytes > 0) {
            builder.artifactPath("/backups/local/backup_local.zip").artifactBytes(bytes);
        }
        if (status == RunStatusEnum.FAILED) {
            builder.failureType(bytes > 0 ? FailureTypeEnum.PARTIAL_JOB_FAILURE : FailureTypeEnum.DUMP_ERROR)
                    .errorSummary("dump failed");
        }
        return builder.build();
    }

    @Test
    void jobsFromConfigurationAreRegisteredInOrder() {
        StatusSnapshot snapshot = this.statusStore.snapshot();

        assertEquals(List.of("alpha", "beta"), new ArrayList<>(snapshot.getJobs().keySet()));
        JobStatus beta = snapshot.getJobs().get("beta");
        assertEquals("every 1 days", beta.getSchedule());
        assertEquals(List.of("crm", "erp"), beta.getDatabases());
        assertEquals(1, snapshot.getConfigSummary().getDatabaseConnections());
        assertEquals(2, snapshot.getConfigSummary().getBackupJobs());
        assertFalse(snapshot.getConfigSummary().isUploadConfigured());
        assertEquals(ShutdownStateEnum.RUNNING, snapshot.getShutdownState());
    }

    @Test
    void recordUpdatesCountersHistoryAndInFlightTogether() {
        this.statusStore.markStarted("alpha", T0);
        assertTrue(this.statusStore.snapshot().getJobs().get("alpha").isInFlight());
        assertEquals(T0, this.statusStore.snapshot().getJobs().get("alpha").getRunningSince());

        JobRun success = run("alpha", RunStatusEnum.SUCCESS, 1000);
        this.statusStore.record(success);

        StatusSnapshot snapshot = this.statusStore.snapshot();
        JobStatus alpha = snapshot.getJobs().get("alpha");
        assertFalse(alpha.isInFlight());
        assertNull(alpha.getRunningSince());
        assertSame(success, alpha.getLastRun());
        assertEquals(1, snapshot.getCounters().getTotalRuns());
        assertEquals(1, snapshot.getCounters().getSuccesses());
        assertEquals(1000, snapshot.getCounters().getCumulativeBytes());
        assertEquals(List.of(success), snapshot.getRecentRuns());
        assertEquals(100.0, snapshot.getSuccessRate());
    }

    @Test
    void partialFailureCountsAsFailureButItsBytesAreKept() {
        this.statusStore.record(run("alpha", RunStatusEnum.SUCCESS, 1000));
        this.statusStore.record(run("beta", RunStatusEnum.FAILED, 400));
        this.statusStore.record(run("beta", RunStatusEnum.FAILED, 0));

        StatusSnapshot snapshot = this.statusStore.snapshot();
        assertEquals(3, snapshot.getCounters().getTotalRuns());
        assertEquals(1, snapshot.getCounters().getSuccesses());
        assertEquals(2, snapshot.getCounters().getFailures());
        assertEquals(1400, snapshot.getCounters().getCumulativeBytes());
        assertEquals(100.0 / 3, snapshot.getSuccessRate(), 0.001);
    }

    @Test
    void historyIsBoundedAndEvictsOldestFirst() {
        List<JobRun> runs = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            JobRun jobRun = run("alpha", RunStatusEnum.SUCCESS, 10);
            runs.add(jobRun);
            this.statusStore.record(jobRun);
        }

        List<JobRun> history = this.statusStore.history("alpha");
        assertEquals(5, history.size());
        assertEquals(runs.subList(3, 8), history);
        // 计数器不受 history 上限影响
        assertEquals(8, this.statusStore.snapshot().getCounters().getTotalRuns());
        // recent runs 新的在前
        assertSame(runs.get(7), this.statusStore.snapshot().getRecentRuns().get(0));
    }

    @Test
    void snapshotIsDetachedFromStore() {
        this.statusStore.setNextDue("alpha", T0.plus(Duration.ofHours(6)));
        StatusSnapshot snapshot = this.statusStore.snapshot();

        snapshot.getJobs().get("alpha").setNextDue(null);
        snapshot.getJobs().remove("beta");
        snapshot.getCounters().setTotalRuns(99);
        snapshot.getConfigSummary().setBackupJobs(99);

        StatusSnapshot fresh = this.statusStore.snapshot();
        assertEquals(T0.plus(Duration.ofHours(6)), fresh.getJobs().get("alpha").getNextDue());
        assertTrue(fresh.getJobs().containsKey("beta"));
        assertEquals(0, fresh.getCounters().getTotalRuns());
        assertEquals(2, fresh.getConfigSummary().getBackupJobs());
        assertEquals(T0.plus(Duration.ofHours(6)), fresh.getNextRun());
    }

    @Test
    void uploadOutcomesAreCountedPerStatus() {
        for (UploadStatusEnum status : List.of(
                UploadStatusEnum.SUCCESS, UploadStatusEnum.FAILED, UploadStatusEnum.SKIPPED, UploadStatusEnum.SUCCESS)) {
            this.statusStore.recordUpload(UploadRecord.builder()
                    .runId("r").jobName("alpha").status(status).attempts(1).finishedAt(T0).build());
        }

        StatusSnapshot snapshot = this.statusStore.snapshot();
        assertEquals(2, snapshot.getCounters().getUploadsSucceeded());
        assertEquals(1, snapshot.getCounters().getUploadsFailed());
        assertEquals(1, snapshot.getCounters().getUploadsSkipped());
        assertEquals(UploadStatusEnum.SUCCESS, snapshot.getJobs().get("alpha").getLastUpload().getStatus());
        // upload 不影响 run 计数
        assertEquals(0, snapshot.getCounters().getTotalRuns());
    }

    @Test
    void countersStayConsistentUnderConcurrentRecords() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        int perThread = 200;
        for (int t = 0; t < 8; t++) {
            RunStatusEnum status = t % 2 == 0 ? RunStatusEnum.SUCCESS : RunStatusEnum.FAILED;
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    this.statusStore.record(run("alpha", status, 0));
                }
            });
        }
        long previousTotal = 0;
        start.countDown();
        pool.shutdown();
        while (!pool.awaitTermination(5, TimeUnit.MILLISECONDS)) {
            StatusSnapshot snapshot = this.statusStore.snapshot();
            long total = snapshot.getCounters().getTotalRuns();
            assertTrue(total >= previousTotal);
            assertEquals(total, snapshot.getCounters().getSuccesses() + snapshot.getCounters().getFailures());
            previousTotal = total;
        }
        assertEquals(8L * perThread, this.statusStore.snapshot().getCounters().getTotalRuns());
    }

    @Test
    void invalidInputIsRejected() {
        assertThrows(ValidationException.class, () -> this.statusStore.record(null));
        assertThrows(ValidationException.class, () -> this.statusStore.record(JobRun.builder().jobName("alpha").build()));
        assertThrows(ValidationException.class, () -> this.statusStore.recordUpload(UploadRecord.builder().build()));
        assertThrows(ResourceNotFoundException.class, () -> this.statusStore.history("unknown"));
    }

    @Test
    void schedulerAndShutdownFlagsAreReported() {
        this.statusStore.setSchedulerRunning(true);
        this.statusStore.setShutdownState(ShutdownStateEnum.SHUTDOWN_REQUESTED);

        StatusSnapshot snapshot = this.statusStore.snapshot();
        assertTrue(snapshot.isSchedulerRunning());
        assertEquals(ShutdownStateEnum.SHUTDOWN_REQUESTED, snapshot.getShutdownState());
        assertEquals(T0, snapshot.getCapturedAt());
    }
}
