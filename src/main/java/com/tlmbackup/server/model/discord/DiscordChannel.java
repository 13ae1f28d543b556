package com.tlmbackup.server.model.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscordChannel {

    public static final int GUILD_FORUM = 15;

    private String id;

    private String name;

    // channel type, 15 为 forum
    private int type;

    public boolean isForum() {
        return this.type == GUILD_FORUM;
    }
}
