package com.tlmbackup.server.service.scheduler;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.FailureTypeEnum;
import com.tlmbackup.server.enums.RunStatusEnum;
import com.tlmbackup.server.enums.TriggerTypeEnum;
import com.tlmbackup.server.exception.BusinessException;
import com.tlmbackup.server.exception.ResourceNotFoundException;
import com.tlmbackup.server.exception.SchedulerInternalException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.DatabaseTarget;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.internal.BackupArtifact;
import com.tlmbackup.server.model.internal.EventOrigin;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.model.internal.SchedulerHandle;
import com.tlmbackup.server.service.executor.JobExecutor;
import com.tlmbackup.server.service.shutdown.ShutdownCoordinator;
import com.tlmbackup.server.service.status.StatusStore;
import com.tlmbackup.server.service.upload.UploadDispatcher;
import com.tlmbackup.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns the timing loop.
 * <p>
 * A single tick thread scans all jobs at a fixed delay and launches every due job that is
 * not already running on the job pool, so a slow backup never delays the scan or another job. A due time
 * that passes while the job is still running is skipped, not queued: the next due time is
 * then computed from the completion instant. Failures are recorded and the loop goes on.
 * <p>
 * Finalizing a run always happens in this order: status store, next due time, event,
 * upload hand-off, last-run bookkeeping, slot release.
 */
@Slf4j
@Service
public class BackupScheduler implements DisposableBean {

    private final JobExecutor jobExecutor;

    private final StatusStore statusStore;

    private final EventBroadcaster eventBroadcaster;

    private final UploadDispatcher uploadDispatcher;

    private final ShutdownCoordinator shutdownCoordinator;

    private final LastRunStore lastRunStore;

    private final BackupSettings backupSettings;

    private final ThreadPoolTaskScheduler tickScheduler;

    private final ThreadPoolTaskExecutor backupJobExecutor;

    private final Clock clock;

    private final Object lifecycleLock = new Object();

    private final Object tickLock = new Object();

    // key: job name, 按配置顺序
    private final Map<String, JobSlot> slots = Collections.synchronizedMap(new LinkedHashMap<>());

    private final Set<RunAttempt> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicLong generation = new AtomicLong(0L);

    private volatile SchedulerHandle currentHandle;

    private ScheduledFuture<?> tickFuture;

    @Autowired
    public BackupScheduler(
            JobExecutor jobExecutor,
            StatusStore statusStore,
            EventBroadcaster eventBroadcaster,
            UploadDispatcher uploadDispatcher,
            ShutdownCoordinator shutdownCoordinator,
            LastRunStore lastRunStore,
            BackupSettings backupSettings,
            @Qualifier("schedulerTickScheduler") ThreadPoolTaskScheduler tickScheduler,
            @Qualifier("backupJobExecutor") ThreadPoolTaskExecutor backupJobExecutor,
            Clock clock) {
        this.jobExecutor = jobExecutor;
        this.statusStore = statusStore;
        this.eventBroadcaster = eventBroadcaster;
        this.uploadDispatcher = uploadDispatcher;
        this.shutdownCoordinator = shutdownCoordinator;
        this.lastRunStore = lastRunStore;
        this.backupSettings = backupSettings;
        this.tickScheduler = tickScheduler;
        this.backupJobExecutor = backupJobExecutor;
        this.clock = clock;
        // 未启动时也可以手动触发
        this.reloadSlots(backupSettings.getJobs());
    }

    /**
     * Starts the tick loop over {@code jobs}. Starting a running scheduler returns the
     * current handle and changes nothing.
     */
    public SchedulerHandle start(List<JobSpec> jobs) throws ValidationException, BusinessException {
        if (jobs == null) {
            throw new ValidationException("start failed. jobs is null");
        }
        synchronized (lifecycleLock) {
            if (!this.shutdownCoordinator.isAcceptingWork()) {
                throw BusinessException.conflict("start failed. shutdown in progress");
            }
            if (this.currentHandle != null) {
                log.info("start ignored. scheduler already running, generation {}", this.currentHandle.getGeneration());
                return this.currentHandle;
            }
            BackupSettings.validateJobs(jobs, this.backupSettings.getDatabases().stream()
                    .map(DatabaseTarget::getName)
                    .collect(Collectors.toSet()));
            this.reloadSlots(jobs);
            this.statusStore.registerJobs(jobs);
            Instant now = this.clock.instant();
            for (JobSlot slot : this.slotsSnapshot()) {
                Instant lastRun = latest(slot.getLastRunStartedAt(), this.lastRunStore.get(slot.getJobName()));
                slot.setLastRunStartedAt(lastRun);
                Instant nextDue = slot.getJobSpec().getSchedule().nextDue(lastRun, now);
                slot.setNextDue(nextDue);
                this.statusStore.setNextDue(slot.getJobName(), nextDue);
            }
            SchedulerHandle handle = new SchedulerHandle(this.generation.incrementAndGet(), now, jobs.size());
            try {
                this.tickFuture = this.tickScheduler.scheduleWithFixedDelay(
                        this::tick,
                        Duration.ofMillis(this.backupSettings.getScheduler().getTickIntervalMillis()));
            } catch (TaskRejectedException e) {
                throw new SchedulerInternalException("start failed. tick loop could not be scheduled", e);
            }
            this.currentHandle = handle;
            this.statusStore.setSchedulerRunning(true);
            log.info("scheduler started. generation {}, {} job(s)", handle.getGeneration(), jobs.size());
            this.eventBroadcaster.info(EventOrigin.SCHEDULER, "Scheduler started with %d job(s)".formatted(jobs.size()));
            return handle;
        }
    }

    /**
     * Stops the tick loop. Runs already in flight are left to finish. A handle from an
     * earlier start is ignored. A tick that is already scanning finishes first, so no run
     * is launched after this returns.
     */
    public void stop(SchedulerHandle handle) {
        synchronized (lifecycleLock) {
            SchedulerHandle current = this.currentHandle;
            if (handle == null || current == null || handle.getGeneration() != current.getGeneration()) {
                log.info("stop ignored. handle {} is not the running one {}", handle, current);
                return;
            }
            if (this.tickFuture != null) {
                this.tickFuture.cancel(false);
                this.tickFuture = null;
            }
            // 等待正在进行的 tick
            synchronized (tickLock) {
                this.currentHandle = null;
            }
            this.statusStore.setSchedulerRunning(false);
            log.info("scheduler stopped. generation {}, {} run(s) still in flight",
                    handle.getGeneration(), this.inFlight.size());
            this.eventBroadcaster.info(EventOrigin.SCHEDULER, "Scheduler stopped");
        }
    }

    public boolean isRunning() {
        return this.currentHandle != null;
    }

    public SchedulerHandle getCurrentHandle() {
        return this.currentHandle;
    }

    public List<JobSpec> getJobs() {
        return this.slotsSnapshot().stream().map(JobSlot::getJobSpec).toList();
    }

    public int getInFlightCount() {
        return this.inFlight.size();
    }

    /**
     * One scan over all jobs. Errors are contained per job and per tick.
     */
    public void tick() {
        synchronized (tickLock) {
            try {
                if (this.currentHandle == null || !this.shutdownCoordinator.isAcceptingWork()) {
                    return;
                }
                Instant now = this.clock.instant();
                for (JobSlot slot : this.slotsSnapshot()) {
                    try {
                        if (!slot.isDue(now)) {
                            continue;
                        }
                        // 上一次还在运行, 本次跳过, 不排队
                        if (slot.isInFlight()) {
                            log.debug("tick. job {} due but still in flight, skipped", slot.getJobName());
                            continue;
                        }
                        this.launch(slot, TriggerTypeEnum.SCHEDULED);
                    } catch (Exception e) {
                        this.reportInternalError(slot.getJobName(), e);
                    }
                }
            } catch (Exception e) {
                this.reportInternalError(null, e);
            }
        }
    }

    /**
     * Runs a job now, outside its schedule, and waits for the finalized run.
     *
     * @throws BusinessException 409 when the job is already running or shutdown has begun
     */
    public JobRun triggerJob(String jobName) throws ResourceNotFoundException, BusinessException {
        if (!this.shutdownCoordinator.isAcceptingWork()) {
            throw BusinessException.conflict("triggerJob failed. shutdown in progress");
        }
        JobSlot slot = this.slots.get(jobName);
        if (slot == null) {
            throw new ResourceNotFoundException("triggerJob failed. job %s not found".formatted(jobName));
        }
        RunAttempt runAttempt = this.launch(slot, TriggerTypeEnum.MANUAL);
        if (runAttempt == null && !this.shutdownCoordinator.isAcceptingWork()) {
            throw BusinessException.conflict("triggerJob failed. shutdown in progress");
        }
        if (runAttempt == null) {
            throw BusinessException.conflict("triggerJob failed. job %s is already running".formatted(jobName));
        }
        try {
            return runAttempt.getResult().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("triggerJob interrupted while waiting for job %s".formatted(jobName), e);
        } catch (ExecutionException e) {
            throw new SchedulerInternalException("triggerJob failed. job %s".formatted(jobName), e.getCause());
        }
    }

    /**
     * Blocks until no run is in flight.
     *
     * @param timeout null or non-positive waits indefinitely
     * @return false when runs were still in flight at the timeout
     */
    public boolean awaitInFlight(Duration timeout) throws InterruptedException {
        boolean unbounded = timeout == null || timeout.isZero() || timeout.isNegative();
        long deadline = unbounded ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        synchronized (this.inFlight) {
            while (!this.inFlight.isEmpty()) {
                long remainingMillis = unbounded ? 0L : (deadline - System.nanoTime()) / 1_000_000L;
                if (!unbounded && remainingMillis <= 0) {
                    return false;
                }
                this.inFlight.wait(unbounded ? 1000L : Math.min(remainingMillis, 1000L));
            }
            return true;
        }
    }

    // context 关闭 (SIGTERM) 时, 停止调度并等待 in-flight run 完成
    @Override
    public void destroy() throws InterruptedException {
        this.stop(this.currentHandle);
        long gracefulTimeoutSec = this.backupSettings.getShutdown().getGracefulTimeoutSec();
        if (!this.awaitInFlight(Duration.ofSeconds(gracefulTimeoutSec))) {
            log.warn("destroy. {} run(s) still in flight after {}s, abandoning them",
                    this.inFlight.size(), gracefulTimeoutSec);
        }
    }

    /**
     * @return the launched attempt, or null when the job is already in flight or shutdown
     * has begun
     */
    private RunAttempt launch(JobSlot slot, TriggerTypeEnum trigger) {
        if (!slot.tryAcquire()) {
            return null;
        }
        JobSpec jobSpec = slot.getJobSpec();
        RunAttempt runAttempt = new RunAttempt(UUID.randomUUID().toString(), jobSpec, trigger, this.clock.instant());
        // 与 awaitInFlight 同一把锁: shutdown 开始后不再加入, 已加入的一定会被等待
        synchronized (this.inFlight) {
            if (!this.shutdownCoordinator.isAcceptingWork()) {
                slot.release();
                log.info("launch skipped. job {}, shutdown in progress", jobSpec.getName());
                return null;
            }
            this.inFlight.add(runAttempt);
        }
        slot.setCurrent(runAttempt);
        this.statusStore.markStarted(jobSpec.getName(), runAttempt.getStartedAt());
        log.info("launch. job {}, run {}, trigger {}", jobSpec.getName(), runAttempt.getRunId(), trigger);
        this.eventBroadcaster.info(EventOrigin.job(jobSpec.getName()), "%s backup started (%s)"
                .formatted(trigger == TriggerTypeEnum.MANUAL ? "Manual" : "Scheduled", jobSpec.getSchedule().describe()));
        try {
            runAttempt.setWorker(this.backupJobExecutor.submit(() -> this.runAttempt(slot, runAttempt)));
        } catch (TaskRejectedException e) {
            log.error("launch failed. job pool rejected job {}", jobSpec.getName(), e);
            this.finalizeRun(slot, runAttempt, this.failedRun(runAttempt, FailureTypeEnum.INTERNAL_ERROR,
                    "Job could not be started: worker pool rejected it"));
            return runAttempt;
        }
        long jobTimeoutSec = this.backupSettings.getScheduler().getJobTimeoutSec();
        if (jobTimeoutSec > 0) {
            // 超时按 worker 真实经过的时间计算, 不跟随注入的 clock (clock 可能被拨动)
            runAttempt.setTimeoutFuture(this.tickScheduler.schedule(
                    () -> this.onTimeout(slot, runAttempt, jobTimeoutSec),
                    Instant.now().plusSeconds(jobTimeoutSec)));
        }
        return runAttempt;
    }

    private void runAttempt(JobSlot slot, RunAttempt runAttempt) {
        JobRun jobRun;
        try {
            jobRun = this.jobExecutor.execute(
                    runAttempt.getJobSpec(),
                    runAttempt.getTrigger(),
                    runAttempt.getRunId(),
                    runAttempt.getStartedAt());
        } catch (Exception e) {
            log.error("runAttempt failed. job {} threw unexpectedly", runAttempt.getJobName(), e);
            jobRun = this.failedRun(runAttempt, FailureTypeEnum.INTERNAL_ERROR, "Unexpected error: " + e);
        }
        if (!this.finalizeRun(slot, runAttempt, jobRun)) {
            log.warn("runAttempt. run {} of job {} finished after it was finalized, result discarded",
                    runAttempt.getRunId(), runAttempt.getJobName());
        }
    }

    private void onTimeout(JobSlot slot, RunAttempt runAttempt, long jobTimeoutSec) {
        JobRun timeoutRun = this.failedRun(runAttempt, FailureTypeEnum.TIMEOUT,
                "Job timed out after %ds".formatted(jobTimeoutSec));
        if (this.finalizeRun(slot, runAttempt, timeoutRun) && runAttempt.getWorker() != null) {
            // 中断 worker, 正在运行的 dump 进程会被销毁
            runAttempt.getWorker().cancel(true);
        }
    }

    /**
     * @return false when the attempt was already finalized
     */
    private boolean finalizeRun(JobSlot slot, RunAttempt runAttempt, JobRun jobRun) {
        if (!runAttempt.tryFinalize()) {
            return false;
        }
        String jobName = runAttempt.getJobName();
        try {
            if (runAttempt.getTimeoutFuture() != null) {
                runAttempt.getTimeoutFuture().cancel(false);
            }
            // 1. status store
            this.statusStore.record(jobRun);
            // 2. next due
            Instant completedAt = this.clock.instant();
            Instant nextDue = this.computeNextDue(runAttempt, completedAt);
            slot.setLastRunStartedAt(runAttempt.getStartedAt());
            slot.setNextDue(nextDue);
            this.statusStore.setNextDue(jobName, nextDue);
            // 3. event
            this.publishOutcome(jobRun);
            // 4. upload, 部分失败的 archive 也上传
            if (jobRun.hasArtifact()) {
                this.uploadDispatcher.submit(BackupArtifact.fromRun(jobRun, Paths.get(jobRun.getArtifactPath())));
            }
            // 5. last run
            this.lastRunStore.save(jobName, runAttempt.getStartedAt());
        } catch (Exception e) {
            this.reportInternalError(jobName, e);
        } finally {
            slot.release();
            runAttempt.getResult().complete(jobRun);
            synchronized (this.inFlight) {
                this.inFlight.remove(runAttempt);
                this.inFlight.notifyAll();
            }
        }
        return true;
    }

    // start + interval; 超时运行的 job 从完成时间重新计算
    private Instant computeNextDue(RunAttempt runAttempt, Instant completedAt) {
        Duration interval = runAttempt.getJobSpec().getSchedule().getInterval();
        if (interval == null) {
            return null;
        }
        Instant nextDue = runAttempt.getStartedAt().plus(interval);
        if (nextDue.isBefore(completedAt)) {
            log.info("computeNextDue. job {} overran its due time {}, rescheduled from completion",
                    runAttempt.getJobName(), nextDue);
            return completedAt.plus(interval);
        }
        return nextDue;
    }

    private void publishOutcome(JobRun jobRun) {
        String origin = EventOrigin.job(jobRun.getJobName());
        double seconds = jobRun.getDurationMillis() / 1000.0;
        if (jobRun.getStatus() == RunStatusEnum.SUCCESS) {
            log.info("job {} succeeded. archive {}, {} bytes", jobRun.getJobName(),
                    jobRun.getArtifactPath(), jobRun.getArtifactBytes());
            this.eventBroadcaster.info(origin, "Backup completed in %.1fs: %s (%s)".formatted(
                    seconds, jobRun.getArtifactPath(), FilesystemUtil.formatMegabytes(jobRun.getArtifactBytes())));
            return;
        }
        log.warn("job {} failed. failure type {}, {}", jobRun.getJobName(),
                jobRun.getFailureType(), jobRun.getErrorSummary());
        this.eventBroadcaster.error(origin, "Backup failed after %.1fs [%s]: %s".formatted(
                seconds,
                ObjectUtils.isEmpty(jobRun.getFailureType()) ? "unknown" : jobRun.getFailureType().getName(),
                jobRun.getErrorSummary()));
    }

    private JobRun failedRun(RunAttempt runAttempt, FailureTypeEnum failureType, String summary) {
        return JobRun.builder()
                .runId(runAttempt.getRunId())
                .jobName(runAttempt.getJobName())
                .targetName(runAttempt.getJobSpec().getTarget())
                .trigger(runAttempt.getTrigger())
                .startedAt(runAttempt.getStartedAt())
                .finishedAt(this.clock.instant())
                .status(RunStatusEnum.FAILED)
                .failureType(failureType)
                .errorSummary(summary)
                .build();
    }

    private void reportInternalError(String jobName, Exception e) {
        SchedulerInternalException internalException = new SchedulerInternalException(
                jobName == null ? "scheduler tick failed" : "scheduler failed on job %s".formatted(jobName), e);
        log.error("scheduler internal error.", internalException);
        try {
            this.eventBroadcaster.error(EventOrigin.SCHEDULER, internalException.getChainMessage());
        } catch (RuntimeException publishException) {
            log.error("scheduler internal error could not be published.", publishException);
        }
    }

    // 保留运行中 job 的 slot, 避免重复运行
    private void reloadSlots(List<JobSpec> jobs) {
        synchronized (this.slots) {
            Map<String, JobSlot> reloaded = new LinkedHashMap<>();
            for (JobSpec jobSpec : jobs) {
                JobSlot slot = this.slots.get(jobSpec.getName());
                if (slot == null) {
                    slot = new JobSlot(jobSpec);
                } else {
                    slot.setJobSpec(jobSpec);
                }
                reloaded.put(jobSpec.getName(), slot);
            }
            this.slots.forEach((name, slot) -> {
                if (!reloaded.containsKey(name) && slot.isInFlight()) {
                    reloaded.put(name, slot);
                }
            });
            this.slots.clear();
            this.slots.putAll(reloaded);
        }
    }

    private List<JobSlot> slotsSnapshot() {
        synchronized (this.slots) {
            return new ArrayList<>(this.slots.values());
        }
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
