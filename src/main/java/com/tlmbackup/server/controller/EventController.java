package com.tlmbackup.server.controller;

import com.tlmbackup.server.model.api.global.TlmBackupHttpResponse;
import com.tlmbackup.server.model.internal.BackupEvent;
import com.tlmbackup.server.service.facade.BackupControlService;
import com.tlmbackup.server.service.facade.EventStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping("/events")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class EventController {

    private final BackupControlService backupControlService;

    private final EventStreamService eventStreamService;

    @Autowired
    public EventController(BackupControlService backupControlService, EventStreamService eventStreamService) {
        this.backupControlService = backupControlService;
        this.eventStreamService = eventStreamService;
    }

    @GetMapping("/recent")
    public TlmBackupHttpResponse<List<BackupEvent>> getRecentEvents() {
        return TlmBackupHttpResponse.success(this.backupControlService.recentEvents());
    }

    // 先回放缓冲区中的事件, 再推送新事件
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents() {
        return this.eventStreamService.openStream();
    }
}
