package com.tlmbackup.server.model.internal;

import com.tlmbackup.server.enums.EventLevelEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A log line published to live subscribers.
 * <p>
 * A gap marker ({@code gap == true}) is never published; a subscription emits it locally
 * after dropping {@code droppedCount} events for being too slow.
 */
@Value
@Builder
public class BackupEvent {

    long seq;

    Instant timestamp;

    EventLevelEnum level;

    String origin;

    String message;

    boolean gap;

    long droppedCount;

    public static BackupEvent gapMarker(long droppedCount) {
        return BackupEvent.builder()
                .seq(-1L)
                .timestamp(Instant.now())
                .level(EventLevelEnum.WARN)
                .origin(EventOrigin.SYSTEM)
                .message("%d event(s) dropped, subscriber too slow".formatted(droppedCount))
                .gap(true)
                .droppedCount(droppedCount)
                .build();
    }
}
