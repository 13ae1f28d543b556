package com.tlmbackup.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class UploadException extends TlmBackupException {

    public UploadException(String message) {
        super(HttpStatus.BAD_GATEWAY, message);
    }

    public UploadException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
