package com.tlmbackup.server.service.facade;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.exception.BusinessException;
import com.tlmbackup.server.exception.ResourceNotFoundException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.api.status.ConfigSummary;
import com.tlmbackup.server.model.api.status.JobStatus;
import com.tlmbackup.server.model.api.status.SchedulerSummary;
import com.tlmbackup.server.model.api.status.StatusSnapshot;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.BackupEvent;
import com.tlmbackup.server.model.internal.EventOrigin;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.model.internal.SchedulerHandle;
import com.tlmbackup.server.service.scheduler.BackupScheduler;
import com.tlmbackup.server.service.shutdown.ShutdownCoordinator;
import com.tlmbackup.server.service.status.StatusStore;
import com.tlmbackup.server.service.upload.UploadDispatcher;
import com.tlmbackup.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the HTTP layer. Reads go to the status store and the broadcaster,
 * control calls go to the scheduler and the shutdown coordinator.
 */
@Slf4j
@Service
public class BackupControlService {

    private final BackupScheduler backupScheduler;

    private final StatusStore statusStore;

    private final EventBroadcaster eventBroadcaster;

    private final ShutdownCoordinator shutdownCoordinator;

    private final UploadDispatcher uploadDispatcher;

    private final BackupSettings backupSettings;

    @Autowired
    public BackupControlService(
            BackupScheduler backupScheduler,
            StatusStore statusStore,
            EventBroadcaster eventBroadcaster,
            ShutdownCoordinator shutdownCoordinator,
            UploadDispatcher uploadDispatcher,
            BackupSettings backupSettings) {
        this.backupScheduler = backupScheduler;
        this.statusStore = statusStore;
        this.eventBroadcaster = eventBroadcaster;
        this.shutdownCoordinator = shutdownCoordinator;
        this.uploadDispatcher = uploadDispatcher;
        this.backupSettings = backupSettings;
    }

    public SchedulerHandle startScheduler() throws ValidationException, BusinessException {
        return this.backupScheduler.start(this.backupSettings.getJobs());
    }

    public void stopScheduler() {
        SchedulerHandle handle = this.backupScheduler.getCurrentHandle();
        if (handle == null) {
            log.info("stopScheduler ignored. scheduler is not running");
            return;
        }
        this.backupScheduler.stop(handle);
    }

    public JobRun triggerJob(String jobName) throws ResourceNotFoundException, BusinessException {
        if (StringUtils.isBlank(jobName)) {
            throw new ValidationException("triggerJob failed. jobName is blank");
        }
        log.info("triggerJob. manual run of job {} requested", jobName);
        return this.backupScheduler.triggerJob(jobName);
    }

    // 和第一次 Ctrl+C 相同, 不提供强制退出
    public ShutdownStateEnum requestShutdown() throws BusinessException {
        if (!this.shutdownCoordinator.isAcceptingWork()) {
            throw BusinessException.conflict("requestShutdown failed. shutdown already %s"
                    .formatted(this.shutdownCoordinator.getState().getName()));
        }
        this.eventBroadcaster.info(EventOrigin.SYSTEM, "Shutdown requested from the control API");
        return this.shutdownCoordinator.onInterrupt();
    }

    public Map<String, String> testUploadTargets() throws BusinessException {
        if (!this.uploadDispatcher.hasUploaders()) {
            throw new BusinessException(HttpStatus.BAD_REQUEST, "testUploadTargets failed. no upload target configured");
        }
        return this.uploadDispatcher.testUploaders();
    }

    public StatusSnapshot getStatus() {
        return this.statusStore.snapshot();
    }

    public List<JobRun> getHistory(String jobName) throws ValidationException, ResourceNotFoundException {
        if (StringUtils.isBlank(jobName)) {
            throw new ValidationException("getHistory failed. jobName is blank");
        }
        return this.statusStore.history(jobName);
    }

    public List<JobStatus> listJobs() {
        return new ArrayList<>(this.statusStore.snapshot().getJobs().values());
    }

    public SchedulerSummary getSchedulerSummary() {
        StatusSnapshot snapshot = this.statusStore.snapshot();
        SchedulerSummary schedulerSummary = new SchedulerSummary();
        schedulerSummary.setSchedulerRunning(snapshot.isSchedulerRunning());
        schedulerSummary.setShutdownState(snapshot.getShutdownState().getName());
        schedulerSummary.setNextRun(snapshot.getNextRun());
        schedulerSummary.setTotalBackups(snapshot.getCounters().getTotalRuns());
        schedulerSummary.setSuccessful(snapshot.getCounters().getSuccesses());
        schedulerSummary.setSuccessRate(snapshot.getSuccessRate());
        schedulerSummary.setTotalSizeMb(FilesystemUtil.toMegabytes(snapshot.getCounters().getCumulativeBytes()));
        schedulerSummary.setInFlightJobs(snapshot.getInFlightJobs());
        schedulerSummary.setPendingUploads(this.uploadDispatcher.getPendingCount());
        return schedulerSummary;
    }

    public ConfigSummary getConfigSummary() {
        return this.statusStore.snapshot().getConfigSummary();
    }

    public List<BackupEvent> recentEvents() {
        return this.eventBroadcaster.recent();
    }
}
