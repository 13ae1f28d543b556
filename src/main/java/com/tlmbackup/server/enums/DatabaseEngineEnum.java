package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DatabaseEngineEnum {

    MYSQL("MYSQL", 3306),
    ;

    private final String name;

    private final int defaultPort;
}
