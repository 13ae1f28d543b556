package com.tlmbackup.server.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class TlmBackupException extends RuntimeException {

    private HttpStatus status;

    public TlmBackupException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public TlmBackupException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public TlmBackupException(String message) {
        super(message);
    }

    public TlmBackupException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getChainMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // 递归构建完整的异常消息链
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        if (depth > 0) {
            sb.append(" -> ");
        }
        // <exception name> : <exception message>
        sb.append("%s : %s".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof TlmBackupException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getChainMessage();
    }
}
