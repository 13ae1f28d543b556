package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum RunStatusEnum {

    SUCCESS("SUCCESS"),

    FAILED("FAILED"),
    ;

    private final String name;
}
