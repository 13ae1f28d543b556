package com.tlmbackup.server.model.api.status;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RunCounters {

    private long totalRuns;

    private long successes;

    private long failures;

    // 所有写出的 archive 大小, 包括部分失败的 run
    private long cumulativeBytes;

    private long uploadsSucceeded;

    private long uploadsFailed;

    private long uploadsSkipped;

    public RunCounters copy() {
        RunCounters copy = new RunCounters();
        copy.totalRuns = this.totalRuns;
        copy.successes = this.successes;
        copy.failures = this.failures;
        copy.cumulativeBytes = this.cumulativeBytes;
        copy.uploadsSucceeded = this.uploadsSucceeded;
        copy.uploadsFailed = this.uploadsFailed;
        copy.uploadsSkipped = this.uploadsSkipped;
        return copy;
    }

    public double getSuccessRate() {
        if (this.totalRuns == 0) {
            return 0.0;
        }
        return this.successes * 100.0 / this.totalRuns;
    }
}
