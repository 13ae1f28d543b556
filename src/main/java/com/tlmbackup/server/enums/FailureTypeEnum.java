package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum FailureTypeEnum {

    CONNECTION_ERROR("connection_error"),

    DUMP_ERROR("dump_error"),

    PARTIAL_JOB_FAILURE("partial_job_failure"),

    TIMEOUT("timeout"),

    INTERNAL_ERROR("internal_error"),
    ;

    private final String name;
}
