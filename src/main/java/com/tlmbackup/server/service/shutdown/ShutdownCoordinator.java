package com.tlmbackup.server.service.shutdown;

import com.tlmbackup.server.enums.ShutdownStateEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide shutdown state machine.
 * <pre>
 * RUNNING -> SHUTDOWN_REQUESTED -> STOPPED
 *                               -> FORCE_STOPPED (second interrupt)
 * </pre>
 * Work is only admitted while {@code RUNNING}.
 */
@Slf4j
@Component
public class ShutdownCoordinator {

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition terminated = lock.newCondition();

    private final List<ShutdownListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ShutdownStateEnum state = ShutdownStateEnum.RUNNING;

    public void addListener(ShutdownListener listener) {
        this.listeners.add(listener);
    }

    /**
     * First call requests a graceful shutdown, a second call while it is still draining
     * forces it. Later calls change nothing.
     *
     * @return the state after this interrupt
     */
    public ShutdownStateEnum onInterrupt() {
        ShutdownStateEnum from;
        ShutdownStateEnum to;
        lock.lock();
        try {
            from = this.state;
            to = switch (from) {
                case RUNNING -> ShutdownStateEnum.SHUTDOWN_REQUESTED;
                case SHUTDOWN_REQUESTED -> ShutdownStateEnum.FORCE_STOPPED;
                default -> from;
            };
            if (to == from) {
                log.info("onInterrupt ignored. already {}", from);
                return from;
            }
            this.transition(from, to);
        } finally {
            lock.unlock();
        }
        this.notifyListeners(from, to);
        return to;
    }

    /**
     * Marks the end of a graceful shutdown.
     *
     * @return false when the shutdown was forced in the meantime
     */
    public boolean markStopped() {
        ShutdownStateEnum from;
        lock.lock();
        try {
            from = this.state;
            if (ShutdownStateEnum.isTransitionProhibit(from, ShutdownStateEnum.STOPPED)) {
                log.warn("markStopped ignored. current state is {}", from);
                return false;
            }
            this.transition(from, ShutdownStateEnum.STOPPED);
        } finally {
            lock.unlock();
        }
        this.notifyListeners(from, ShutdownStateEnum.STOPPED);
        return true;
    }

    public ShutdownStateEnum getState() {
        return this.state;
    }

    public boolean isAcceptingWork() {
        return this.state == ShutdownStateEnum.RUNNING;
    }

    // 等待进入 STOPPED 或 FORCE_STOPPED
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!this.state.isTerminal()) {
                if (remainingNanos <= 0) {
                    return false;
                }
                remainingNanos = this.terminated.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void transition(ShutdownStateEnum from, ShutdownStateEnum to) {
        log.info("shutdown state {} -> {}", from, to);
        this.state = to;
        if (to.isTerminal()) {
            this.terminated.signalAll();
        }
    }

    private void notifyListeners(ShutdownStateEnum from, ShutdownStateEnum to) {
        for (ShutdownListener listener : this.listeners) {
            try {
                listener.onTransition(from, to);
            } catch (RuntimeException e) {
                log.error("shutdown listener {} failed on {} -> {}", listener, from, to, e);
            }
        }
    }
}
