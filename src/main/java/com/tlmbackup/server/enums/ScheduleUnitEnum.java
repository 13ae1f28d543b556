package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;

@AllArgsConstructor
@Getter
public enum ScheduleUnitEnum {

    MINUTES("MINUTES", 60L),

    HOURS("HOURS", 3600L),

    DAYS("DAYS", 86400L),
    ;

    private final String name;

    private final long seconds;

    public Duration toDuration(long value) {
        return Duration.ofSeconds(Math.multiplyExact(this.seconds, value));
    }

    public String describe(long value) {
        return "every %d %s".formatted(value, this.name.toLowerCase());
    }
}
