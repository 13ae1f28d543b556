package com.tlmbackup.server.model.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DiscordMessage {

    private String content;

    private List<DiscordAttachment> attachments;

    public DiscordMessage(String content) {
        this.content = content;
    }

    public DiscordMessage(String content, List<DiscordAttachment> attachments) {
        this.content = content;
        this.attachments = attachments;
    }
}
