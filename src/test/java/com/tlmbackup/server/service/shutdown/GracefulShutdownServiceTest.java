package com.tlmbackup.server.service.shutdown;

import com.tlmbackup.server.FakeDatabaseDumper;
import com.tlmbackup.server.MutableClock;
import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.ScheduleUnitEnum;
import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.service.dump.DatabaseDumperRegistry;
import com.tlmbackup.server.service.executor.JobExecutor;
import com.tlmbackup.server.service.scheduler.BackupScheduler;
import com.tlmbackup.server.service.scheduler.LastRunStore;
import com.tlmbackup.server.service.status.StatusStore;
import com.tlmbackup.server.service.upload.UploadDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.tlmbackup.server.BackupTestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

class GracefulShutdownServiceTest {

    @TempDir
    Path backupDirectory;

    private final MutableClock clock = new MutableClock(T0);

    private final FakeDatabaseDumper dumper = new FakeDatabaseDumper();

    private final ShutdownCoordinator shutdownCoordinator = new ShutdownCoordinator();

    private final ThreadPoolTaskScheduler tickScheduler = tickScheduler();

    private final ThreadPoolTaskExecutor jobPool = jobExecutor("Test-Job-");

    private final ThreadPoolTaskExecutor uploadPool = executor("Test-Upload-", 1, 10);

    private final RecordingTerminator terminator = new RecordingTerminator();

    private final JobSpec jobSpec = job("nightly", ScheduleUnitEnum.HOURS, 6, "app");

    private StatusStore statusStore;

    private EventBroadcaster eventBroadcaster;

    private BackupScheduler backupScheduler;

    @BeforeEach
    void setUp() {
        BackupSettings backupSettings = settings(this.backupDirectory, this.jobSpec);
        this.statusStore = new StatusStore(backupSettings, this.clock);
        this.eventBroadcaster = new EventBroadcaster(backupSettings, this.clock);
        JobExecutor jobExecutor = new JobExecutor(
                new DatabaseDumperRegistry(List.of(this.dumper)), this.eventBroadcaster, backupSettings, this.clock);
        UploadDispatcher uploadDispatcher = new UploadDispatcher(
                List.of(), this.uploadPool, this.statusStore, this.eventBroadcaster, backupSettings, this.clock);
        this.backupScheduler = new BackupScheduler(
                jobExecutor,
                this.statusStore,
                this.eventBroadcaster,
                uploadDispatcher,
                this.shutdownCoordinator,
                new LastRunStore(new BackupSettings()),
                backupSettings,
                this.tickScheduler,
                this.jobPool,
                this.clock);
        GracefulShutdownService gracefulShutdownService = new GracefulShutdownService(
                this.shutdownCoordinator,
                this.backupScheduler,
                this.statusStore,
                this.eventBroadcaster,
                this.terminator,
                backupSettings);
        gracefulShutdownService.init();
    }

    @AfterEach
    void tearDown() {
        this.dumper.release();
        this.tickScheduler.shutdown();
        this.jobPool.shutdown();
        this.uploadPool.shutdown();
    }

    @Test
    void gracefulShutdownWaitsForInFlightRunThenExitsWithZero() {
        this.dumper.block();
        this.backupScheduler.start(List.of(this.jobSpec));
        waitUntil(() -> this.dumper.getCalls() == 1, 5000);

        this.shutdownCoordinator.onInterrupt();
        waitUntil(() -> !this.backupScheduler.isRunning(), 5000);
        waitMillis(200);

        assertEquals(ShutdownStateEnum.SHUTDOWN_REQUESTED, this.statusStore.snapshot().getShutdownState());
        assertTrue(this.terminator.calls.isEmpty());

        this.dumper.release();
        waitUntil(() -> !this.terminator.calls.isEmpty(), 5000);

        assertEquals(List.of("exit:0"), this.terminator.calls);
        // run 在 STOPPED 之前已经记录
        assertEquals(1, this.terminator.historyAtTermination);
        assertEquals(ShutdownStateEnum.STOPPED, this.shutdownCoordinator.getState());
        assertEquals(ShutdownStateEnum.STOPPED, this.statusStore.snapshot().getShutdownState());
        assertTrue(this.eventBroadcaster.recent().stream()
                .anyMatch(e -> e.getMessage().startsWith("Shutdown requested. Waiting for 1 running job(s)")));
    }

    @Test
    void secondInterruptHaltsWithoutWaiting() {
        this.dumper.block();
        this.backupScheduler.start(List.of(this.jobSpec));
        waitUntil(() -> this.dumper.getCalls() == 1, 5000);

        this.shutdownCoordinator.onInterrupt();
        this.shutdownCoordinator.onInterrupt();

        assertEquals(List.of("halt:130"), this.terminator.calls);
        assertEquals(0, this.terminator.historyAtTermination);
        assertEquals(ShutdownStateEnum.FORCE_STOPPED, this.statusStore.snapshot().getShutdownState());

        // drain 结束后不会再 exit
        this.dumper.release();
        waitUntil(() -> this.backupScheduler.getInFlightCount() == 0, 5000);
        waitMillis(200);
        assertEquals(List.of("halt:130"), this.terminator.calls);
    }

    @Test
    void shutdownWithNothingInFlightStopsAtOnce() {
        this.shutdownCoordinator.onInterrupt();

        waitUntil(() -> !this.terminator.calls.isEmpty(), 5000);
        assertEquals(List.of("exit:0"), this.terminator.calls);
        assertEquals(0, this.dumper.getCalls());
    }

    private class RecordingTerminator implements ProcessTerminator {

        private final List<String> calls = new CopyOnWriteArrayList<>();

        private volatile int historyAtTermination = -1;

        @Override
        public void exit(int exitCode) {
            this.historyAtTermination = statusStore.history("nightly").size();
            this.calls.add("exit:" + exitCode);
        }

        @Override
        public void halt(int exitCode) {
            this.historyAtTermination = statusStore.history("nightly").size();
            this.calls.add("halt:" + exitCode);
        }
    }
}
