package com.tlmbackup.server.service.shutdown;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.enums.ShutdownStateEnum;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.EventOrigin;
import com.tlmbackup.server.service.scheduler.BackupScheduler;
import com.tlmbackup.server.service.status.StatusStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Carries out the transitions of {@link ShutdownCoordinator}: a requested shutdown stops the
 * scheduler, drains in-flight runs and exits with code 0; a forced one halts with 130.
 */
@Slf4j
@Service
public class GracefulShutdownService implements ShutdownListener {

    public static final int FORCE_EXIT_CODE = 130;

    private final ShutdownCoordinator shutdownCoordinator;

    private final BackupScheduler backupScheduler;

    private final StatusStore statusStore;

    private final EventBroadcaster eventBroadcaster;

    private final ProcessTerminator processTerminator;

    private final BackupSettings backupSettings;

    @Autowired
    public GracefulShutdownService(
            ShutdownCoordinator shutdownCoordinator,
            BackupScheduler backupScheduler,
            StatusStore statusStore,
            EventBroadcaster eventBroadcaster,
            ProcessTerminator processTerminator,
            BackupSettings backupSettings) {
        this.shutdownCoordinator = shutdownCoordinator;
        this.backupScheduler = backupScheduler;
        this.statusStore = statusStore;
        this.eventBroadcaster = eventBroadcaster;
        this.processTerminator = processTerminator;
        this.backupSettings = backupSettings;
    }

    @PostConstruct
    public void init() {
        this.shutdownCoordinator.addListener(this);
    }

    @Override
    public void onTransition(ShutdownStateEnum from, ShutdownStateEnum to) {
        this.statusStore.setShutdownState(to);
        switch (to) {
            case SHUTDOWN_REQUESTED -> {
                int inFlight = this.backupScheduler.getInFlightCount();
                this.eventBroadcaster.warn(EventOrigin.SYSTEM, ("Shutdown requested. Waiting for %d running job(s) " +
                        "to finish, interrupt again to force exit").formatted(inFlight));
                Thread drainThread = new Thread(this::drain, "Graceful-Shutdown-Thread");
                drainThread.setDaemon(false);
                drainThread.start();
            }
            case STOPPED -> {
                this.eventBroadcaster.info(EventOrigin.SYSTEM, "Shutdown complete");
                this.processTerminator.exit(0);
            }
            case FORCE_STOPPED -> {
                this.eventBroadcaster.error(EventOrigin.SYSTEM, "Forced shutdown, abandoning %d running job(s)"
                        .formatted(this.backupScheduler.getInFlightCount()));
                this.processTerminator.halt(FORCE_EXIT_CODE);
            }
            default -> log.warn("onTransition. unexpected transition {} -> {}", from, to);
        }
    }

    // 停止调度, 等待 in-flight run 完成, 然后进入 STOPPED
    void drain() {
        this.backupScheduler.stop(this.backupScheduler.getCurrentHandle());
        long gracefulTimeoutSec = this.backupSettings.getShutdown().getGracefulTimeoutSec();
        try {
            if (!this.backupScheduler.awaitInFlight(Duration.ofSeconds(gracefulTimeoutSec))) {
                log.warn("drain. {} run(s) still in flight after {}s, stopping anyway",
                        this.backupScheduler.getInFlightCount(), gracefulTimeoutSec);
            }
        } catch (InterruptedException e) {
            log.warn("drain interrupted. stopping without waiting for in-flight runs", e);
            Thread.currentThread().interrupt();
        }
        if (!this.shutdownCoordinator.markStopped()) {
            log.info("drain. shutdown was forced while draining");
        }
    }
}
