package com.tlmbackup.server.service.scheduler;

import com.tlmbackup.server.enums.TriggerTypeEnum;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.internal.JobRun;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One launched run. Whoever finalizes it first (the worker or the timeout watchdog) wins;
 * the other result is discarded.
 */
@Getter
class RunAttempt {

    private final String runId;

    private final JobSpec jobSpec;

    private final TriggerTypeEnum trigger;

    private final Instant startedAt;

    private final CompletableFuture<JobRun> result = new CompletableFuture<>();

    private final AtomicBoolean finalized = new AtomicBoolean(false);

    @Setter
    private volatile Future<?> worker;

    @Setter
    private volatile ScheduledFuture<?> timeoutFuture;

    RunAttempt(String runId, JobSpec jobSpec, TriggerTypeEnum trigger, Instant startedAt) {
        this.runId = runId;
        this.jobSpec = jobSpec;
        this.trigger = trigger;
        this.startedAt = startedAt;
    }

    String getJobName() {
        return this.jobSpec.getName();
    }

    boolean tryFinalize() {
        return this.finalized.compareAndSet(false, true);
    }

    boolean isFinalized() {
        return this.finalized.get();
    }
}
