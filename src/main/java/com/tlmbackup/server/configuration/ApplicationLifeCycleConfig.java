package com.tlmbackup.server.configuration;


import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.service.scheduler.BackupScheduler;
import com.tlmbackup.server.util.FilesystemUtil;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.nio.file.Paths;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final BackupSettings backupSettings;

    private final BackupScheduler backupScheduler;

    @Autowired
    public ApplicationLifeCycleConfig(BackupSettings backupSettings, BackupScheduler backupScheduler) {
        this.backupSettings = backupSettings;
        this.backupScheduler = backupScheduler;
    }

    @PostConstruct
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        // 配置错误直接启动失败
        this.backupSettings.validate();
        FilesystemUtil.ensureFolder(Paths.get(this.backupSettings.getBackupDirectory()));
        log.info("{} database connection(s), {} backup job(s), backup directory {}",
                this.backupSettings.getDatabases().size(),
                this.backupSettings.getJobs().size(),
                this.backupSettings.getBackupDirectory());
        if (!this.backupSettings.getUpload().getDiscord().isConfigured()) {
            log.warn("no upload target configured. backups are kept locally only");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startScheduler() {
        if (!this.backupSettings.getScheduler().isAutoStart()) {
            log.info("scheduler auto start disabled");
            return;
        }
        this.backupScheduler.start(this.backupSettings.getJobs());
    }
}
