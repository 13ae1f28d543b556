package com.tlmbackup.server.model.config;

import com.tlmbackup.server.exception.ResourceNotFoundException;
import com.tlmbackup.server.exception.ValidationException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties("tlmbackup.server")
@Component
@Data
@NoArgsConstructor
public class BackupSettings {

    private String backupDirectory = "./backups";

    private List<DatabaseTarget> databases = new ArrayList<>();

    private List<JobSpec> jobs = new ArrayList<>();

    private Scheduler scheduler = new Scheduler();

    private Events events = new Events();

    private Upload upload = new Upload();

    private Dump dump = new Dump();

    private Shutdown shutdown = new Shutdown();

    @Data
    public static class Scheduler {
        private boolean autoStart = true;

        private long tickIntervalMillis = 5000L;

        // 0 表示不限制
        private long jobTimeoutSec = 0L;

        // 常驻的 job 线程数, 超出时为每个 run 新建线程, 不排队
        private int coreJobThreads = 4;

        private int historyRetention = 50;

        private int recentRunsRetention = 20;

        // last-run 记录文件, 为空则不持久化
        private String stateFile;
    }

    @Data
    public static class Events {
        private int replayBufferSize = 100;

        private int subscriberBufferSize = 256;

        private long sseTimeoutMillis = 0L;

        private int maxStreams = 16;
    }

    @Data
    public static class Upload {
        private int maxAttempts = 3;

        private long initialBackoffMillis = 2000L;

        private double backoffMultiplier = 2.0;

        private int queueCapacity = 100;

        private Discord discord = new Discord();
    }

    @Data
    public static class Discord {
        @ToString.Exclude
        private String botToken;

        private String guildId;

        private String forumChannelName = "database-backups";

        private String apiBaseUrl = "https://discord.com/api/v10";

        private long maxFileSizeBytes = 8L * 1024 * 1024;

        public boolean isConfigured() {
            return StringUtils.isNoneBlank(this.botToken, this.guildId);
        }
    }

    @Data
    public static class Dump {
        private String mysqldumpPath = "mysqldump";

        private List<String> extraArgs = new ArrayList<>(List.of(
                "--single-transaction", "--routines", "--triggers"));

        private long timeoutSec = 3600L;
    }

    @Data
    public static class Shutdown {
        private boolean handleSignals = true;

        // 0 表示一直等待 in-flight job 完成
        private long gracefulTimeoutSec = 0L;
    }

    public DatabaseTarget getTarget(String targetName) throws ResourceNotFoundException {
        if (StringUtils.isBlank(targetName)) {
            throw new ResourceNotFoundException("getTarget failed. targetName is blank");
        }
        for (DatabaseTarget databaseTarget : this.databases) {
            if (targetName.equals(databaseTarget.getName())) {
                return databaseTarget;
            }
        }
        throw new ResourceNotFoundException("getTarget failed. target %s not configured".formatted(targetName));
    }

    public void validate() throws ValidationException {
        if (StringUtils.isBlank(this.backupDirectory)) {
            throw new ValidationException("validate failed. backupDirectory is blank");
        }
        Set<String> targetNames = new HashSet<>();
        for (DatabaseTarget databaseTarget : this.databases) {
            if (StringUtils.isBlank(databaseTarget.getName())) {
                throw new ValidationException("validate failed. database target without name");
            }
            if (ObjectUtils.isEmpty(databaseTarget.getEngine())) {
                throw new ValidationException("validate failed. target %s has no engine"
                        .formatted(databaseTarget.getName()));
            }
            if (!targetNames.add(databaseTarget.getName())) {
                throw new ValidationException("validate failed. duplicate target name %s"
                        .formatted(databaseTarget.getName()));
            }
        }
        validateJobs(this.jobs, targetNames);
        if (this.scheduler.getTickIntervalMillis() <= 0 || this.scheduler.getCoreJobThreads() <= 0) {
            throw new ValidationException("validate failed. tickIntervalMillis and coreJobThreads must be positive");
        }
        if (this.scheduler.getHistoryRetention() <= 0 || this.events.getReplayBufferSize() < 0
                || this.events.getSubscriberBufferSize() <= 0) {
            throw new ValidationException("validate failed. history and event buffer sizes must be positive");
        }
        if (this.upload.getMaxAttempts() <= 0 || this.upload.getQueueCapacity() <= 0) {
            throw new ValidationException("validate failed. upload maxAttempts and queueCapacity must be positive");
        }
    }

    public static void validateJobs(List<JobSpec> jobs, Set<String> targetNames) throws ValidationException {
        Set<String> jobNames = new HashSet<>();
        for (JobSpec jobSpec : jobs) {
            if (StringUtils.isBlank(jobSpec.getTarget())) {
                throw new ValidationException("validate failed. job %s has no target".formatted(jobSpec.getName()));
            }
            if (!targetNames.contains(jobSpec.getTarget())) {
                throw new ValidationException("validate failed. job %s references unknown target %s"
                        .formatted(jobSpec.getName(), jobSpec.getTarget()));
            }
            if (CollectionUtils.isEmpty(jobSpec.getDatabases())
                    || jobSpec.getDatabases().stream().anyMatch(StringUtils::isBlank)) {
                throw new ValidationException("validate failed. job %s has no database or a blank database name"
                        .formatted(jobSpec.getName()));
            }
            Schedule schedule = jobSpec.getSchedule();
            if (ObjectUtils.isEmpty(schedule)) {
                throw new ValidationException("validate failed. job %s has no schedule".formatted(jobSpec.getName()));
            }
            if (schedule.isEnabled() && (ObjectUtils.isEmpty(schedule.getUnit()) || schedule.getValue() <= 0)) {
                throw new ValidationException("validate failed. job %s schedule needs a unit and a positive value"
                        .formatted(jobSpec.getName()));
            }
            if (!jobNames.add(jobSpec.getName())) {
                throw new ValidationException("validate failed. duplicate job name %s".formatted(jobSpec.getName()));
            }
        }
    }
}
