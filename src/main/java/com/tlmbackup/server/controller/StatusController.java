package com.tlmbackup.server.controller;

import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import com.tlmbackup.server.model.api.status.ConfigSummary;
import com.tlmbackup.server.model.api.status.SchedulerSummary;
import com.tlmbackup.server.model.api.status.StatusSnapshot;
import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.service.facade.BackupControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/status")
@Slf4j
@CrossOrigin
public class StatusController {

    private final BackupControlService backupControlService;

    @Autowired
    public StatusController(BackupControlService backupControlService) {
        this.backupControlService = backupControlService;
    }

    @GetMapping
    public TlmBackupHttpResponse<StatusSnapshot> getStatus() {
        return TlmBackupHttpResponse.success(this.backupControlService.getStatus());
    }

    @GetMapping("/history")
    public TlmBackupHttpResponse<List<JobRun>> getHistory(@RequestParam("job") String jobName) {
        return TlmBackupHttpResponse.success(this.backupControlService.getHistory(jobName));
    }

    @GetMapping("/scheduler")
    public TlmBackupHttpResponse<SchedulerSummary> getSchedulerSummary() {
        return TlmBackupHttpResponse.success(this.backupControlService.getSchedulerSummary());
    }

    @GetMapping("/config-summary")
    public TlmBackupHttpResponse<ConfigSummary> getConfigSummary() {
        return TlmBackupHttpResponse.success(this.backupControlService.getConfigSummary());
    }
}
