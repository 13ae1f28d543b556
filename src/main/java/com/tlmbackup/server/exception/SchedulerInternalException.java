package com.tlmbackup.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class SchedulerInternalException extends TlmBackupException {

    public SchedulerInternalException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public SchedulerInternalException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
