package com.tlmbackup.server.model.internal;

import com.tlmbackup.server.enums.FailureTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of dumping one database of a job. {@code bytes} is the size of the raw dump file.
 */
@Value
@AllArgsConstructor
public class DatabaseDumpResult {

    String databaseName;

    boolean success;

    long bytes;

    long durationMillis;

    FailureTypeEnum failureType;

    String error;

    public static DatabaseDumpResult success(String databaseName, long bytes, long durationMillis) {
        return new DatabaseDumpResult(databaseName, true, bytes, durationMillis, null, null);
    }

    public static DatabaseDumpResult failed(
            String databaseName, long durationMillis, FailureTypeEnum failureType, String error) {
        return new DatabaseDumpResult(databaseName, false, 0L, durationMillis, failureType, error);
    }
}
