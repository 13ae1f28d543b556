package com.tlmbackup.server.model.api.status;

import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.model.internal.JobRun;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the status store. Mutating it has no effect on the store.
 */
@Data
@NoArgsConstructor
public class StatusSnapshot {

    private Instant capturedAt;

    private boolean schedulerRunning;

    private ShutdownStateEnum shutdownState;

    // key: job name, 按配置顺序
    private Map<String, JobStatus> jobs = new LinkedHashMap<>();

    private RunCounters counters = new RunCounters();

    // 所有 job 最近的 run, 新的在前
    private List<JobRun> recentRuns = new ArrayList<>();

    private ConfigSummary configSummary;

    public double getSuccessRate() {
        return this.counters.getSuccessRate();
    }

    public Instant getNextRun() {
        Instant nextRun = null;
        for (JobStatus jobStatus : this.jobs.values()) {
            Instant nextDue = jobStatus.getNextDue();
            if (nextDue != null && (nextRun == null || nextDue.isBefore(nextRun))) {
                nextRun = nextDue;
            }
        }
        return nextRun;
    }

    public int getInFlightJobs() {
        return (int) this.jobs.values().stream().filter(JobStatus::isInFlight).count();
    }
}
