package com.tlmbackup.server.service.upload;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.UploadStatusEnum;
import com.tlmbackup.server.exception.UploadException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.BackupArtifact;
import com.tlmbackup.server.model.internal.EventOrigin;
import com.tlmbackup.server.model.internal.UploadRecord;
import com.tlmbackup.server.service.status.StatusStore;
import com.tlmbackup.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands finished archives to the configured uploaders in the background.
 * <p>
 * {@link #submit} only enqueues. Each uploader gets a bounded number of attempts with
 * exponential backoff. The outcome lands in the status store as an {@link UploadRecord}
 * and never changes the run it came from.
 */
@Slf4j
@Service
public class UploadDispatcher {

    private final List<BackupUploader> backupUploaders;

    private final ThreadPoolTaskExecutor uploadExecutor;

    private final StatusStore statusStore;

    private final EventBroadcaster eventBroadcaster;

    private final BackupSettings.Upload uploadSettings;

    private final Clock clock;

    private final AtomicInteger pending = new AtomicInteger(0);

    @Autowired
    public UploadDispatcher(
            List<BackupUploader> backupUploaders,
            @Qualifier("uploadExecutor") ThreadPoolTaskExecutor uploadExecutor,
            StatusStore statusStore,
            EventBroadcaster eventBroadcaster,
            BackupSettings backupSettings,
            Clock clock) {
        this.backupUploaders = backupUploaders.stream().filter(BackupUploader::isConfigured).toList();
        this.uploadExecutor = uploadExecutor;
        this.statusStore = statusStore;
        this.eventBroadcaster = eventBroadcaster;
        this.uploadSettings = backupSettings.getUpload();
        this.clock = clock;
        log.info("upload dispatcher ready. active uploaders are {}",
                this.backupUploaders.stream().map(BackupUploader::getName).toList());
    }

    public void submit(BackupArtifact artifact) throws ValidationException {
        if (artifact == null || artifact.getPath() == null) {
            throw new ValidationException("submit failed. artifact or path is null");
        }
        if (this.backupUploaders.isEmpty()) {
            this.record(artifact, null, UploadStatusEnum.SKIPPED, 0, "no upload target configured");
            return;
        }
        this.pending.incrementAndGet();
        try {
            this.uploadExecutor.execute(() -> {
                try {
                    this.deliver(artifact);
                } finally {
                    this.pending.decrementAndGet();
                }
            });
        } catch (TaskRejectedException e) {
            this.pending.decrementAndGet();
            log.error("submit failed. upload queue is full, archive {} not uploaded", artifact.getPath(), e);
            this.record(artifact, null, UploadStatusEnum.FAILED, 0, "upload queue full");
            this.eventBroadcaster.error(EventOrigin.UPLOAD, "Upload of %s dropped: upload queue full"
                    .formatted(artifact.getPath().getFileName()));
        }
    }

    /**
     * Checks every configured uploader without sending an archive.
     *
     * @return uploader name to "ok" or the failure message
     */
    public Map<String, String> testUploaders() {
        Map<String, String> result = new LinkedHashMap<>();
        for (BackupUploader backupUploader : this.backupUploaders) {
            try {
                backupUploader.testConnection();
                result.put(backupUploader.getName(), "ok");
            } catch (UploadException e) {
                log.warn("testUploaders. uploader {} failed", backupUploader.getName(), e);
                result.put(backupUploader.getName(), e.getChainMessage());
            }
        }
        return result;
    }

    public int getPendingCount() {
        return this.pending.get();
    }

    public boolean hasUploaders() {
        return !this.backupUploaders.isEmpty();
    }

    private void deliver(BackupArtifact artifact) {
        for (BackupUploader backupUploader : this.backupUploaders) {
            this.deliverWithRetry(backupUploader, artifact);
        }
    }

    void deliverWithRetry(BackupUploader backupUploader, BackupArtifact artifact) {
        String fileName = artifact.getPath().getFileName().toString();
        int maxAttempts = this.uploadSettings.getMaxAttempts();
        this.eventBroadcaster.info(EventOrigin.UPLOAD, "Uploading %s (%s) to %s".formatted(
                fileName, FilesystemUtil.formatMegabytes(artifact.getBytes()), backupUploader.getName()));
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                backupUploader.upload(artifact);
                this.record(artifact, backupUploader.getName(), UploadStatusEnum.SUCCESS, attempt, "uploaded");
                this.eventBroadcaster.info(EventOrigin.UPLOAD, "Uploaded %s to %s"
                        .formatted(fileName, backupUploader.getName()));
                return;
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("deliverWithRetry failed. uploader is {}, attempt {}/{}",
                        backupUploader.getName(), attempt, maxAttempts, e);
            }
            if (attempt < maxAttempts) {
                long backoffMillis = this.backoffMillis(attempt);
                this.eventBroadcaster.warn(EventOrigin.UPLOAD, "Upload attempt %d/%d of %s failed, retrying in %d ms"
                        .formatted(attempt, maxAttempts, fileName, backoffMillis));
                try {
                    Thread.sleep(backoffMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("deliverWithRetry interrupted. archive {} not uploaded", fileName);
                    this.record(artifact, backupUploader.getName(), UploadStatusEnum.FAILED, attempt, "interrupted");
                    this.eventBroadcaster.error(EventOrigin.UPLOAD, "Upload of %s interrupted".formatted(fileName));
                    return;
                }
            }
        }
        this.record(artifact, backupUploader.getName(), UploadStatusEnum.FAILED, maxAttempts, lastError);
        this.eventBroadcaster.error(EventOrigin.UPLOAD, "Upload of %s to %s failed after %d attempt(s): %s"
                .formatted(fileName, backupUploader.getName(), maxAttempts, lastError));
    }

    // initialBackoff * multiplier^(attempt-1)
    long backoffMillis(int attempt) {
        return (long) (this.uploadSettings.getInitialBackoffMillis()
                * Math.pow(this.uploadSettings.getBackoffMultiplier(), attempt - 1));
    }

    private void record(
            BackupArtifact artifact, String uploader, UploadStatusEnum status, int attempts, String message) {
        this.statusStore.recordUpload(UploadRecord.builder()
                .runId(artifact.getRunId())
                .jobName(artifact.getJobName())
                .artifactPath(artifact.getPath().toString())
                .uploader(uploader)
                .status(status)
                .attempts(attempts)
                .message(message)
                .finishedAt(this.clock.instant())
                .build());
    }
}
