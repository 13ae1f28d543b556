package com.tlmbackup.server.model.api.global;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.tlmbackup.server.exception.TlmBackupException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class TlmBackupHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private TlmBackupHttpResponse() {}

    public static <T> TlmBackupHttpResponse<T> success(T data, String message) {
        TlmBackupHttpResponse<T> result = new TlmBackupHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> TlmBackupHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static TlmBackupHttpResponse<Void> success() {
        return success(null);
    }

    public static TlmBackupHttpResponse<Void> fail(TlmBackupException e) {
        TlmBackupHttpResponse<Void> result = new TlmBackupHttpResponse<>();
        // fall back 方法
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getChainMessage();
        return result;
    }
}
