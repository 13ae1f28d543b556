package com.tlmbackup.server.enums;

import lombok.Getter;

@Getter
public enum MysqldumpExitCodeEnum {

    SUCCESS(0, "Command was successful"),

    USAGE(1, "Invalid command line options"),

    MYSQL_ERROR(2, "Error returned by the server or connection failure"),

    CONSISTENCY_CHECK(3, "Consistency check failed"),

    OUT_OF_MEMORY(4, "Out of memory"),

    WRITE_ERROR(5, "Failed to write the dump output"),

    ILLEGAL_TABLE(6, "Illegal table name"),

    UNKNOWN(-1, "Unknown exit code");

    private final int code;

    private final String message;

    MysqldumpExitCodeEnum(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public static MysqldumpExitCodeEnum fromCode(int code) {
        for (MysqldumpExitCodeEnum value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
