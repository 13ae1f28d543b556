package com.tlmbackup.server.service.upload;

import com.tlmbackup.server.exception.UploadException;
import com.tlmbackup.server.model.internal.BackupArtifact;

/**
 * Delivers a finished archive somewhere off the machine. Calls are blocking and are
 * retried by {@link UploadDispatcher}, never by the implementation.
 */
public interface BackupUploader {

    String getName();

    // 未配置的 uploader 不会被 dispatcher 使用
    boolean isConfigured();

    void upload(BackupArtifact artifact) throws UploadException;

    void testConnection() throws UploadException;
}
