package com.tlmbackup.server.model.discord;

import com.tlmbackup.server.exception.UploadException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;

@Data
public class DiscordResponse<T> {

    private int httpCode;

    private boolean success;

    private T data;

    // has response but http code is not 2xx
    private DiscordErrorInfo errorInfo;

    // does not have response
    private UploadException ex;

    private DiscordResponse() {}

    public static <T> DiscordResponse<T> success(int httpCode, T data) {
        DiscordResponse<T> discordResponse = new DiscordResponse<>();
        discordResponse.setHttpCode(httpCode);
        discordResponse.setSuccess(true);
        discordResponse.setData(data);
        return discordResponse;
    }

    public static <T> DiscordResponse<T> error(int httpCode, DiscordErrorInfo errorInfo) {
        DiscordResponse<T> discordResponse = new DiscordResponse<>();
        discordResponse.setHttpCode(httpCode);
        discordResponse.setSuccess(false);
        discordResponse.setErrorInfo(errorInfo);
        return discordResponse;
    }

    public static <T> DiscordResponse<T> error(Throwable ex) {
        DiscordResponse<T> discordResponse = new DiscordResponse<>();
        discordResponse.setSuccess(false);
        discordResponse.setEx(new UploadException("discord request failed with unexpected exception", ex));
        return discordResponse;
    }

    public UploadException getUploadException(String action) {
        if (this.success) return null;
        if (ObjectUtils.isNotEmpty(this.errorInfo)) {
            return new UploadException("%s failed. discord responded %d. errorInfo is %s"
                    .formatted(action, this.httpCode, this.errorInfo));
        }
        return new UploadException("%s failed.".formatted(action), this.ex);
    }

    // 失败时抛出, 成功时返回 data
    public T getOrThrow(String action) throws UploadException {
        UploadException uploadException = this.getUploadException(action);
        if (uploadException != null) {
            throw uploadException;
        }
        return this.data;
    }
}
