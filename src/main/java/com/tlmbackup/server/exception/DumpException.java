package com.tlmbackup.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


/**
 * The dump tool reached the database but failed to produce a dump.
 */
@EqualsAndHashCode(callSuper = false)
public class DumpException extends TlmBackupException {

    public DumpException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public DumpException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
