package com.tlmbackup.server.model.api.status;

import com.tlmbackup.server.model.internal.JobRun;
import com.tlmbackup.server.model.internal.UploadRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class JobStatus {

    private String jobName;

    private String targetName;

    private List<String> databases = new ArrayList<>();

    private String schedule;

    private JobRun lastRun;

    private Instant nextDue;

    private boolean inFlight;

    private Instant runningSince;

    private UploadRecord lastUpload;

    // JobRun 和 UploadRecord 不可变, 浅拷贝即可
    public JobStatus copy() {
        JobStatus copy = new JobStatus();
        copy.jobName = this.jobName;
        copy.targetName = this.targetName;
        copy.databases = new ArrayList<>(this.databases);
        copy.schedule = this.schedule;
        copy.lastRun = this.lastRun;
        copy.nextDue = this.nextDue;
        copy.inFlight = this.inFlight;
        copy.runningSince = this.runningSince;
        copy.lastUpload = this.lastUpload;
        return copy;
    }
}
