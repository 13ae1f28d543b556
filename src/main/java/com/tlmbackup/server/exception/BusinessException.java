package com.tlmbackup.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@EqualsAndHashCode(callSuper = false)
public class BusinessException extends TlmBackupException {

    public BusinessException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public BusinessException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    public BusinessException(HttpStatus status, String message) {
        super(status, message);
    }

    // 409, 操作与当前状态冲突 (job 正在运行, 系统正在关闭)
    public static BusinessException conflict(String message) {
        return new BusinessException(HttpStatus.CONFLICT, message);
    }
}
