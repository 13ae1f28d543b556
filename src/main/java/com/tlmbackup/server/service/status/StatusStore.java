package com.tlmbackup.server.service.status;

import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.enums.UploadStatusEnum;
import com.tlmbackup.server.exception.ResourceNotFoundException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.api.status.ConfigSummary;
import com.tlmbackup.server.model.api.status.JobStatus;
import com.tlmbackup.server.model.api.status.RunCounters;
import com.tlmbackup.server.model.api.status.StatusSnapshot;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.JobSpec;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.model.internal.UploadRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Owns the live state shown by the dashboard: per-job last run and next due time,
 * run history and the aggregate counters.
 * <p>
 * Every mutation and every snapshot goes through a single lock, so a reader never sees
 * the counters and the history out of step. Callers never lock anything themselves.
 * Counters only ever grow.
 */
@Slf4j
@Service
public class StatusStore {

    private final Object lock = new Object();

    private final Clock clock;

    private final int historyRetention;

    private final int recentRunsRetention;

    private final Map<String, JobStatus> jobs = new LinkedHashMap<>();

    private final Map<String, Deque<JobRun>> histories = new HashMap<>();

    private final Deque<JobRun> recentRuns = new ArrayDeque<>();

    private final RunCounters counters = new RunCounters();

    private final ConfigSummary configSummary;

    private boolean schedulerRunning = false;

    private ShutdownStateEnum shutdownState = ShutdownStateEnum.RUNNING;

    @Autowired
    public StatusStore(BackupSettings backupSettings, Clock clock) {
        this.clock = clock;
        this.historyRetention = backupSettings.getScheduler().getHistoryRetention();
        this.recentRunsRetention = backupSettings.getScheduler().getRecentRunsRetention();
        this.configSummary = new ConfigSummary(
                backupSettings.getDatabases().size(),
                backupSettings.getJobs().size(),
                backupSettings.getUpload().getDiscord().isConfigured(),
                backupSettings.getBackupDirectory()
        );
        this.registerJobs(backupSettings.getJobs());
    }

    // 已存在的 job 只更新配置信息, 保留历史
    public void registerJobs(List<JobSpec> jobSpecs) {
        synchronized (lock) {
            for (JobSpec jobSpec : jobSpecs) {
                JobStatus jobStatus = this.jobs.computeIfAbsent(jobSpec.getName(), this::newJobStatus);
                jobStatus.setTargetName(jobSpec.getTarget());
                jobStatus.setDatabases(new ArrayList<>(jobSpec.getDatabases()));
                jobStatus.setSchedule(jobSpec.getSchedule().describe());
            }
            this.configSummary.setBackupJobs(this.jobs.size());
        }
    }

    public void markStarted(String jobName, Instant startedAt) {
        synchronized (lock) {
            JobStatus jobStatus = this.jobs.computeIfAbsent(jobName, this::newJobStatus);
            jobStatus.setInFlight(true);
            jobStatus.setRunningSince(startedAt);
        }
    }

    /**
     * Finalizes one run: appends it to the job history, updates the counters and clears
     * the in-flight flag, all in one step.
     */
    public void record(JobRun jobRun) throws ValidationException {
        if (jobRun == null || jobRun.getStatus() == null || StringUtils.isBlank(jobRun.getJobName())) {
            throw new ValidationException("record failed. jobRun, status or jobName is null");
        }
        synchronized (lock) {
            Deque<JobRun> history = this.histories.computeIfAbsent(jobRun.getJobName(), k -> new ArrayDeque<>());
            history.addLast(jobRun);
            while (history.size() > this.historyRetention) {
                history.pollFirst();
            }
            this.recentRuns.addFirst(jobRun);
            while (this.recentRuns.size() > this.recentRunsRetention) {
                this.recentRuns.pollLast();
            }
            this.counters.setTotalRuns(this.counters.getTotalRuns() + 1);
            if (jobRun.isSuccess()) {
                this.counters.setSuccesses(this.counters.getSuccesses() + 1);
            } else {
                this.counters.setFailures(this.counters.getFailures() + 1);
            }
            // 部分失败的 archive 同样计入
            this.counters.setCumulativeBytes(this.counters.getCumulativeBytes() + jobRun.getArtifactBytes());
            JobStatus jobStatus = this.jobs.computeIfAbsent(jobRun.getJobName(), this::newJobStatus);
            jobStatus.setLastRun(jobRun);
            jobStatus.setInFlight(false);
            jobStatus.setRunningSince(null);
        }
        log.debug("record run {} of job {}. status is {}",
                jobRun.getRunId(), jobRun.getJobName(), jobRun.getStatus());
    }

    public void setNextDue(String jobName, Instant nextDue) {
        synchronized (lock) {
            this.jobs.computeIfAbsent(jobName, this::newJobStatus).setNextDue(nextDue);
        }
    }

    public void recordUpload(UploadRecord uploadRecord) throws ValidationException {
        if (uploadRecord == null || ObjectUtils.anyNull(uploadRecord.getStatus(), uploadRecord.getJobName())) {
            throw new ValidationException("recordUpload failed. uploadRecord, status or jobName is null");
        }
        synchronized (lock) {
            this.jobs.computeIfAbsent(uploadRecord.getJobName(), this::newJobStatus).setLastUpload(uploadRecord);
            UploadStatusEnum status = uploadRecord.getStatus();
            switch (status) {
                case SUCCESS -> this.counters.setUploadsSucceeded(this.counters.getUploadsSucceeded() + 1);
                case FAILED -> this.counters.setUploadsFailed(this.counters.getUploadsFailed() + 1);
                case SKIPPED -> this.counters.setUploadsSkipped(this.counters.getUploadsSkipped() + 1);
                default -> {
                    // PENDING 不计数
                }
            }
        }
    }

    public void setSchedulerRunning(boolean running) {
        synchronized (lock) {
            this.schedulerRunning = running;
        }
    }

    public void setShutdownState(ShutdownStateEnum shutdownState) {
        synchronized (lock) {
            this.shutdownState = shutdownState;
        }
    }

    public StatusSnapshot snapshot() {
        synchronized (lock) {
            StatusSnapshot snapshot = new StatusSnapshot();
            snapshot.setCapturedAt(this.clock.instant());
            snapshot.setSchedulerRunning(this.schedulerRunning);
            snapshot.setShutdownState(this.shutdownState);
            Map<String, JobStatus> jobsCopy = new LinkedHashMap<>();
            this.jobs.forEach((name, jobStatus) -> jobsCopy.put(name, jobStatus.copy()));
            snapshot.setJobs(jobsCopy);
            snapshot.setCounters(this.counters.copy());
            snapshot.setRecentRuns(new ArrayList<>(this.recentRuns));
            snapshot.setConfigSummary(new ConfigSummary(
                    this.configSummary.getDatabaseConnections(),
                    this.configSummary.getBackupJobs(),
                    this.configSummary.isUploadConfigured(),
                    this.configSummary.getBackupDirectory()));
            return snapshot;
        }
    }

    // oldest first
    public List<JobRun> history(String jobName) throws ResourceNotFoundException {
        synchronized (lock) {
            if (!this.jobs.containsKey(jobName)) {
                throw new ResourceNotFoundException("history failed. job %s not found".formatted(jobName));
            }
            Deque<JobRun> history = this.histories.get(jobName);
            return ObjectUtils.isEmpty(history) ? new ArrayList<>() : new ArrayList<>(history);
        }
    }

    private JobStatus newJobStatus(String jobName) {
        JobStatus jobStatus = new JobStatus();
        jobStatus.setJobName(jobName);
        return jobStatus;
    }
}
