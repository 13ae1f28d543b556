package com.tlmbackup.server.controller;

import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import com.tlmbackup.server.model.api.status.JobStatus;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.service.facade.BackupControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/jobs")
@Slf4j
@CrossOrigin
public class JobController {

    private final BackupControlService backupControlService;

    @Autowired
    public JobController(BackupControlService backupControlService) {
        this.backupControlService = backupControlService;
    }

    @GetMapping
    public TlmBackupHttpResponse<List<JobStatus>> listJobs() {
        return TlmBackupHttpResponse.success(this.backupControlService.listJobs());
    }

    // 阻塞直到 run 结束
    @PostMapping("/{name}/trigger")
    public TlmBackupHttpResponse<JobRun> triggerJob(@PathVariable("name") String jobName) {
        JobRun jobRun = this.backupControlService.triggerJob(jobName);
        return TlmBackupHttpResponse.success(jobRun, jobRun.isSuccess() ? "backup succeeded" : "backup failed");
    }
}
