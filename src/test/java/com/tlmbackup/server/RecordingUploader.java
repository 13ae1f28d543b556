package com.tlmbackup.server;

import com.tlmbackup.server.exception.UploadException;
import com.tlmbackup.server.model.internal.BackupArtifact;
import com.tlmbackup.server.service.upload.BackupUploader;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uploader that keeps what it was given. The first {@code failuresBeforeSuccess} calls fail.
 */
public class RecordingUploader implements BackupUploader {

    private final List<BackupArtifact> uploaded = new CopyOnWriteArrayList<>();

    private final AtomicInteger attempts = new AtomicInteger(0);

    private volatile int failuresBeforeSuccess;

    public RecordingUploader() {
        this(0);
    }

    public RecordingUploader(int failuresBeforeSuccess) {
        this.failuresBeforeSuccess = failuresBeforeSuccess;
    }

    @Override
    public String getName() {
        return "Recording";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public void upload(BackupArtifact artifact) throws UploadException {
        int attempt = this.attempts.incrementAndGet();
        if (attempt <= this.failuresBeforeSuccess) {
            throw new UploadException("upload attempt %d rejected".formatted(attempt));
        }
        this.uploaded.add(artifact);
    }

    @Override
    public void testConnection() throws UploadException {
        if (this.failuresBeforeSuccess == Integer.MAX_VALUE) {
            throw new UploadException("upload target unreachable");
        }
    }

    public void failAlways() {
        this.failuresBeforeSuccess = Integer.MAX_VALUE;
    }

    public List<BackupArtifact> getUploaded() {
        return this.uploaded;
    }

    public int getAttempts() {
        return this.attempts.get();
    }
}
