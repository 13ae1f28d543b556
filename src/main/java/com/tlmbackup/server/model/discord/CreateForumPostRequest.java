package com.tlmbackup.server.model.discord;

import lombok.Data;

@Data
public class CreateForumPostRequest {

    // 帖子标题
    private String name;

    // 帖子首条消息
    private DiscordMessage message;

    public CreateForumPostRequest(String name, DiscordMessage message) {
        this.name = name;
        this.message = message;
    }
}
