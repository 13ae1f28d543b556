package com.tlmbackup.server.service.scheduler;

import com.tlmbackup.server.model.config.JobSpec;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler-side state of one job. The in-flight flag is the only gate for starting a run,
 * for scheduled and manual runs alike.
 */
@Getter
@Setter
class JobSlot {

    private volatile JobSpec jobSpec;

    private volatile Instant lastRunStartedAt;

    // null: 不会被自动调度
    private volatile Instant nextDue;

    private volatile RunAttempt current;

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    JobSlot(JobSpec jobSpec) {
        this.jobSpec = jobSpec;
    }

    String getJobName() {
        return this.jobSpec.getName();
    }

    boolean tryAcquire() {
        return this.inFlight.compareAndSet(false, true);
    }

    void release() {
        this.current = null;
        this.inFlight.set(false);
    }

    boolean isInFlight() {
        return this.inFlight.get();
    }

    boolean isDue(Instant now) {
        Instant due = this.nextDue;
        return due != null && !now.isBefore(due);
    }
}
