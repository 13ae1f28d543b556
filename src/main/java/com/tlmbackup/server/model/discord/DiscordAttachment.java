package com.tlmbackup.server.model.discord;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DiscordAttachment {

    // 对应 multipart 中 files[<id>]
    private int id;

    private String filename;
}
