package com.tlmbackup.server.model.discord;

import lombok.Data;

@Data
public class CreateForumChannelRequest {

    private String name;

    private int type = DiscordChannel.GUILD_FORUM;

    public CreateForumChannelRequest(String name) {
        this.name = name;
    }
}
