package com.tlmbackup.server.service.shutdown;

import com.tlmbackup.server.enums.ShutdownStateEnum;

/**
 * Called after every accepted transition of the {@link ShutdownCoordinator}, outside its lock.
 */
public interface ShutdownListener {

    void onTransition(ShutdownStateEnum from, ShutdownStateEnum to);
}
