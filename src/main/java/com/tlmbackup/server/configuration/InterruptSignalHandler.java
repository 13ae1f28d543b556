package com.tlmbackup.server.configuration;

import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.service.shutdown.ShutdownCoordinator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import sun.misc.Signal;

/**
 * Routes SIGINT to {@link ShutdownCoordinator#onInterrupt()} instead of the JVM default,
 * so the first Ctrl+C drains running backups and the second one forces the exit.
 * SIGTERM keeps the JVM default and closes the context.
 */
@Configuration
@Slf4j
public class InterruptSignalHandler {

    private final ShutdownCoordinator shutdownCoordinator;

    private final BackupSettings backupSettings;

    @Autowired
    public InterruptSignalHandler(ShutdownCoordinator shutdownCoordinator, BackupSettings backupSettings) {
        this.shutdownCoordinator = shutdownCoordinator;
        this.backupSettings = backupSettings;
    }

    @PostConstruct
    public void register() {
        if (!this.backupSettings.getShutdown().isHandleSignals()) {
            log.info("signal handling disabled");
            return;
        }
        try {
            Signal.handle(new Signal("INT"), signal -> this.onSignal());
            log.info("SIGINT handler registered");
        } catch (IllegalArgumentException e) {
            // 平台不支持 SIGINT, 或者被 JVM 参数 -Xrs 禁用
            log.warn("SIGINT handler not registered. interrupts use the JVM default", e);
        }
    }

    void onSignal() {
        ShutdownStateEnum state = this.shutdownCoordinator.onInterrupt();
        if (state == ShutdownStateEnum.SHUTDOWN_REQUESTED) {
            log.warn("Shutdown signal received. Press Ctrl+C again to force exit...");
        } else if (state == ShutdownStateEnum.FORCE_STOPPED) {
            log.warn("Second shutdown signal received. Forcing exit");
        }
    }
}
