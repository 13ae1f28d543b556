package com.tlmbackup.server.model.internal;

import com.tlmbackup.server.enums.UploadStatusEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class UploadRecord {

    String runId;

    String jobName;

    String artifactPath;

    // 上传目标名称, SKIPPED 时为空
    String uploader;

    UploadStatusEnum status;

    int attempts;

    String message;

    Instant finishedAt;
}
