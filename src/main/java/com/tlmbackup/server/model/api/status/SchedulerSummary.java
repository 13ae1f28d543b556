package com.tlmbackup.server.model.api.status;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class SchedulerSummary {

    private boolean schedulerRunning;

    private String shutdownState;

    private Instant nextRun;

    private long totalBackups;

    private long successful;

    private double successRate;

    private double totalSizeMb;

    private int inFlightJobs;

    // 等待上传的 archive 数
    private int pendingUploads;
}
