package com.tlmbackup.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


/**
 * The database target could not be reached, or it rejected the credentials.
 */
@EqualsAndHashCode(callSuper = false)
public class ConnectionException extends TlmBackupException {

    public ConnectionException(String message) {
        super(HttpStatus.BAD_GATEWAY, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
