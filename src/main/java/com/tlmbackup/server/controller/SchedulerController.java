package com.tlmbackup.server.controller;

import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import com.tlmbackup.server.model.internal.SchedulerHandle;
import com.tlmbackup.server.service.facade.BackupControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/scheduler")
@Slf4j
@CrossOrigin
public class SchedulerController {

    private final BackupControlService backupControlService;

    @Autowired
    public SchedulerController(BackupControlService backupControlService) {
        this.backupControlService = backupControlService;
    }

    @PostMapping("/start")
    public TlmBackupHttpResponse<SchedulerHandle> startScheduler() {
        return TlmBackupHttpResponse.success(this.backupControlService.startScheduler());
    }

    @PostMapping("/stop")
    public TlmBackupHttpResponse<Void> stopScheduler() {
        this.backupControlService.stopScheduler();
        return TlmBackupHttpResponse.success();
    }
}
