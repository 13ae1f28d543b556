package com.tlmbackup.server.model.internal;

import lombok.Value;

import java.time.Instant;

/**
 * Identifies one start of the scheduler. Stopping with a handle from an earlier start is a no-op.
 */
@Value
public class SchedulerHandle {

    long generation;

    Instant startedAt;

    int jobCount;
}
