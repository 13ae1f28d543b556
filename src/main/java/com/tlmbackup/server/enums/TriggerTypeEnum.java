package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TriggerTypeEnum {

    SCHEDULED("SCHEDULED"),

    MANUAL("MANUAL"),
    ;

    private final String name;
}
