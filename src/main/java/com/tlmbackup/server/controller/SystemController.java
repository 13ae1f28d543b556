package com.tlmbackup.server.controller;

import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import com.tlmbackup.server.service.facade.BackupControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/system")
@Slf4j
@CrossOrigin
public class SystemController {

    private final BackupControlService backupControlService;

    @Autowired
    public SystemController(BackupControlService backupControlService) {
        this.backupControlService = backupControlService;
    }

    @PostMapping("/shutdown")
    public TlmBackupHttpResponse<ShutdownStateEnum> requestShutdown() {
        return TlmBackupHttpResponse.success(
                this.backupControlService.requestShutdown(),
                "shutdown requested. running backups will finish first");
    }

    @PostMapping("/test-upload")
    public TlmBackupHttpResponse<Map<String, String>> testUploadTargets() {
        return TlmBackupHttpResponse.success(this.backupControlService.testUploadTargets());
    }
}
