package com.tlmbackup.server.service.facade;

import com.tlmbackup.server.bus.EventBroadcaster;
import com.tlmbackup.server.bus.EventSubscription;
import com.tlmbackup.server.exception.BusinessException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.BackupEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;

/**
 * Bridges one {@link EventSubscription} to one SSE connection. Each connection gets its
 * own subscription and pump thread, so a slow client only loses its own events.
 */
@Slf4j
@Service
public class EventStreamService {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final EventBroadcaster eventBroadcaster;

    private final ThreadPoolTaskExecutor eventStreamExecutor;

    private final BackupSettings backupSettings;

    @Autowired
    public EventStreamService(
            EventBroadcaster eventBroadcaster,
            @Qualifier("eventStreamExecutor") ThreadPoolTaskExecutor eventStreamExecutor,
            BackupSettings backupSettings) {
        this.eventBroadcaster = eventBroadcaster;
        this.eventStreamExecutor = eventStreamExecutor;
        this.backupSettings = backupSettings;
    }

    public SseEmitter openStream() throws BusinessException {
        SseEmitter emitter = this.newEmitter(this.backupSettings.getEvents().getSseTimeoutMillis());
        EventSubscription subscription = this.eventBroadcaster.subscribe();
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(throwable -> subscription.close());
        try {
            this.eventStreamExecutor.execute(() -> this.pump(emitter, subscription));
        } catch (TaskRejectedException e) {
            subscription.close();
            throw new BusinessException(HttpStatus.SERVICE_UNAVAILABLE,
                    "openStream failed. too many live event streams, max is %d"
                            .formatted(this.backupSettings.getEvents().getMaxStreams()));
        }
        log.info("event stream {} opened", subscription.getId());
        return emitter;
    }

    SseEmitter newEmitter(long timeoutMillis) {
        return new SseEmitter(timeoutMillis);
    }

    private void pump(SseEmitter emitter, EventSubscription subscription) {
        try {
            while (!subscription.isClosed()) {
                BackupEvent event = subscription.poll(HEARTBEAT_INTERVAL);
                if (event == null) {
                    if (!subscription.isClosed()) {
                        emitter.send(SseEmitter.event().comment("heartbeat"));
                    }
                    continue;
                }
                emitter.send(toSseEvent(event));
            }
        } catch (IOException | IllegalStateException e) {
            // 客户端断开
            log.info("event stream {} closed by client. {}", subscription.getId(), e.getMessage());
        } catch (InterruptedException e) {
            log.info("event stream {} interrupted", subscription.getId());
            Thread.currentThread().interrupt();
        } finally {
            subscription.close();
            emitter.complete();
        }
    }

    private static SseEmitter.SseEventBuilder toSseEvent(BackupEvent event) {
        if (event.isGap()) {
            return SseEmitter.event().name("gap").data(event, MediaType.APPLICATION_JSON);
        }
        return SseEmitter.event()
                .id(String.valueOf(event.getSeq()))
                .name("event")
                .data(event, MediaType.APPLICATION_JSON);
    }
}
