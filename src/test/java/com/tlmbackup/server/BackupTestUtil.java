package com.tlmbackup.server;

import com.tlmbackup.server.enums.ScheduleUnitEnum;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.DatabaseTarget;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.config.Schedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

@Slf4j
public class BackupTestUtil {

    public static final String TARGET = "local";

    public static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    // 测试用的小缓冲区和短间隔
    public static BackupSettings settings(Path backupDirectory, JobSpec... jobs) {
        BackupSettings backupSettings = new BackupSettings();
        backupSettings.setBackupDirectory(backupDirectory.toString());
        DatabaseTarget target = new DatabaseTarget();
        target.setName(TARGET);
        target.setUsername("backup");
        target.setPassword("secret");
        backupSettings.setDatabases(new ArrayList<>(List.of(target)));
        backupSettings.setJobs(new ArrayList<>(Arrays.asList(jobs)));
        backupSettings.getScheduler().setTickIntervalMillis(20L);
        backupSettings.getScheduler().setHistoryRetention(5);
        backupSettings.getScheduler().setRecentRunsRetention(5);
        backupSettings.getEvents().setReplayBufferSize(10);
        backupSettings.getEvents().setSubscriberBufferSize(4);
        backupSettings.getUpload().setMaxAttempts(3);
        backupSettings.getUpload().setInitialBackoffMillis(10L);
        backupSettings.getUpload().setBackoffMultiplier(2.0);
        backupSettings.getShutdown().setHandleSignals(false);
        return backupSettings;
    }

    public static JobSpec job(String name, ScheduleUnitEnum unit, long value, String... databases) {
        return new JobSpec(name, TARGET, List.of(databases), Schedule.every(unit, value));
    }

    public static ThreadPoolTaskScheduler tickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("Test-Tick-");
        scheduler.initialize();
        return scheduler;
    }

    public static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }

    // 与 backupJobExecutor 相同: 没有队列, 每个 run 立即获得线程
    public static ThreadPoolTaskExecutor jobExecutor(String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }

    public static void waitUntil(BooleanSupplier condition, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within %d ms".formatted(timeoutMillis));
            }
            waitMillis(10);
        }
    }

    public static void waitMillis(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("waitMillis interrupted", e);
        }
    }
}
