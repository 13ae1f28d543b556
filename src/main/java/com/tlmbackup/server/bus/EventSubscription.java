package com.tlmbackup.server.bus;

import com.tlmbackup.server.model.internal.BackupEvent;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One subscriber's view of the event stream. Events come out in publish order.
 * <p>
 * When the buffer is full the oldest buffered event is dropped. The next read then returns
 * a single gap marker carrying the number of dropped events, followed by the remaining events.
 */
public class EventSubscription implements AutoCloseable {

    @Getter
    private final String id = UUID.randomUUID().toString();

    private final EventBroadcaster owner;

    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition notEmpty = lock.newCondition();

    private final Deque<BackupEvent> buffer = new ArrayDeque<>();

    // 尚未通知 subscriber 的丢弃数
    private long pendingDropped = 0L;

    @Getter
    private volatile long droppedTotal = 0L;

    private volatile boolean closed = false;

    EventSubscription(EventBroadcaster owner, int capacity) {
        this.owner = owner;
        this.capacity = Math.max(1, capacity);
    }

    void offer(BackupEvent event) {
        lock.lock();
        try {
            if (this.closed) {
                return;
            }
            if (this.buffer.size() >= this.capacity) {
                this.buffer.pollFirst();
                this.pendingDropped++;
                this.droppedTotal++;
            }
            this.buffer.addLast(event);
            this.notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event or gap marker, or null on timeout or once closed
     */
    public BackupEvent poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!this.closed && this.buffer.isEmpty() && this.pendingDropped == 0) {
                if (remainingNanos <= 0) {
                    return null;
                }
                remainingNanos = this.notEmpty.awaitNanos(remainingNanos);
            }
            return this.next();
        } finally {
            lock.unlock();
        }
    }

    // 取出当前所有可读事件, 不等待
    public List<BackupEvent> drain() {
        lock.lock();
        try {
            List<BackupEvent> events = new ArrayList<>();
            BackupEvent event;
            while ((event = this.next()) != null) {
                events.add(event);
            }
            return events;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return this.closed;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (this.closed) {
                return;
            }
            this.closed = true;
            this.buffer.clear();
            this.notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        // 释放本地锁之后再通知 broadcaster, 与 publish 的加锁顺序一致
        this.owner.unsubscribe(this);
    }

    // caller holds lock
    private BackupEvent next() {
        if (this.closed) {
            return null;
        }
        if (this.pendingDropped > 0) {
            BackupEvent gapMarker = BackupEvent.gapMarker(this.pendingDropped);
            this.pendingDropped = 0L;
            return gapMarker;
        }
        return this.buffer.pollFirst();
    }
}
