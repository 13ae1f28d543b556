package com.tlmbackup.server.model.internal;

import com.tlmbackup.server.enums.MysqldumpExitCodeEnum;
import lombok.Value;

@Value
public class CommandResult {

    int exitCode;

    MysqldumpExitCodeEnum exitCodeEnum;

    String stderr;

    // watchdog 超时或者被中断
    boolean killed;

    public boolean isSuccess() {
        return exitCode == 0 && !killed;
    }
}
