package com.tlmbackup.server.bus;

import com.tlmbackup.server.enums.EventLevelEnum;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.internal.BackupEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fan-out of {@link BackupEvent}s to any number of independent subscribers.
 * <p>
 * Publishing never blocks on a subscriber: each subscription owns a bounded buffer and drops
 * its own oldest events when it falls behind. A new subscription starts with the replay buffer
 * so an attaching viewer sees the last few events.
 */
@Slf4j
@Component
public class EventBroadcaster {

    private final Object lock = new Object();

    private final Clock clock;

    private final int replayBufferSize;

    private final int subscriberBufferSize;

    private final Deque<BackupEvent> replayBuffer = new ArrayDeque<>();

    private final Set<EventSubscription> subscriptions = new LinkedHashSet<>();

    private long seq = 0L;

    @Autowired
    public EventBroadcaster(BackupSettings backupSettings, Clock clock) {
        this.clock = clock;
        this.replayBufferSize = backupSettings.getEvents().getReplayBufferSize();
        this.subscriberBufferSize = backupSettings.getEvents().getSubscriberBufferSize();
    }

    public BackupEvent info(String origin, String message) {
        return this.publish(EventLevelEnum.INFO, origin, message);
    }

    public BackupEvent warn(String origin, String message) {
        return this.publish(EventLevelEnum.WARN, origin, message);
    }

    public BackupEvent error(String origin, String message) {
        return this.publish(EventLevelEnum.ERROR, origin, message);
    }

    public BackupEvent publish(EventLevelEnum level, String origin, String message) throws ValidationException {
        if (ObjectUtils.isEmpty(level) || StringUtils.isAnyBlank(origin, message)) {
            throw new ValidationException("publish failed. level, origin or message is empty");
        }
        synchronized (lock) {
            BackupEvent event = BackupEvent.builder()
                    .seq(++this.seq)
                    .timestamp(this.clock.instant())
                    .level(level)
                    .origin(origin)
                    .message(message)
                    .build();
            if (this.replayBufferSize > 0) {
                this.replayBuffer.addLast(event);
                while (this.replayBuffer.size() > this.replayBufferSize) {
                    this.replayBuffer.pollFirst();
                }
            }
            // offer 不会阻塞, 慢的 subscriber 只丢弃自己的事件
            for (EventSubscription subscription : this.subscriptions) {
                subscription.offer(event);
            }
            return event;
        }
    }

    public EventSubscription subscribe() {
        synchronized (lock) {
            EventSubscription subscription = new EventSubscription(this, this.subscriberBufferSize);
            for (BackupEvent event : this.replayBuffer) {
                subscription.offer(event);
            }
            this.subscriptions.add(subscription);
            log.debug("subscribe. subscription {} attached, {} active",
                    subscription.getId(), this.subscriptions.size());
            return subscription;
        }
    }

    void unsubscribe(EventSubscription subscription) {
        synchronized (lock) {
            if (this.subscriptions.remove(subscription)) {
                log.debug("unsubscribe. subscription {} detached, dropped {} event(s) in total",
                        subscription.getId(), subscription.getDroppedTotal());
            }
        }
    }

    // oldest first
    public List<BackupEvent> recent() {
        synchronized (lock) {
            return new ArrayList<>(this.replayBuffer);
        }
    }

    public int getSubscriberCount() {
        synchronized (lock) {
            return this.subscriptions.size();
        }
    }
}
