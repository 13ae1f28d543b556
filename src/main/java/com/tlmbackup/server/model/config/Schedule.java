package com.tlmbackup.server.model.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tlmbackup.server.enums.ScheduleUnitEnum;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Duration;
import java.time.Instant;

/**
 * Recurrence rule of a job. Either {@code unit + value}, or disabled.
 * A disabled schedule never becomes due on its own; the job can still be triggered manually.
 */
@Data
@NoArgsConstructor
public class Schedule {

    private ScheduleUnitEnum unit;

    private long value;

    private boolean enabled = true;

    public static Schedule every(ScheduleUnitEnum unit, long value) {
        Schedule schedule = new Schedule();
        schedule.setUnit(unit);
        schedule.setValue(value);
        return schedule;
    }

    public static Schedule disabled() {
        Schedule schedule = new Schedule();
        schedule.setEnabled(false);
        return schedule;
    }

    @JsonIgnore
    public Duration getInterval() {
        if (!this.enabled || ObjectUtils.isEmpty(this.unit)) {
            return null;
        }
        return this.unit.toDuration(this.value);
    }

    /**
     * @return {@code lastRun + interval}, {@code now} when the job never ran,
     * or null when the schedule is disabled
     */
    public Instant nextDue(Instant lastRun, Instant now) {
        Duration interval = this.getInterval();
        if (interval == null) {
            return null;
        }
        if (lastRun == null) {
            return now;
        }
        return lastRun.plus(interval);
    }

    public String describe() {
        if (!this.enabled || ObjectUtils.isEmpty(this.unit)) {
            return "disabled";
        }
        return this.unit.describe(this.value);
    }
}
