package com.tlmbackup.server.model.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscordErrorInfo { // Discord API 全局的错误响应

    private int code;

    private String message;
}
