package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum UploadStatusEnum {

    PENDING("PENDING"),

    SUCCESS("SUCCESS"),

    FAILED("FAILED"),

    SKIPPED("SKIPPED"), // 没有配置任何 upload target

    ;

    private final String name;
}
