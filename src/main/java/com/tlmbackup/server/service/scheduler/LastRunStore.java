package com.tlmbackup.server.service.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tlmbackup.server.exception.FileOperationException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.util.FilesystemUtil;
import com.tlmbackup.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Start instant of the last run per job, optionally kept in a JSON file so a restart does not
 * run every job again at once. Without a state file it only lives in memory.
 */
@Slf4j
@Component
public class LastRunStore {

    private final Path stateFile;

    private final Map<String, Instant> lastRuns = new TreeMap<>();

    @Autowired
    public LastRunStore(BackupSettings backupSettings) {
        String stateFileString = backupSettings.getScheduler().getStateFile();
        this.stateFile = StringUtils.isBlank(stateFileString) ? null : Paths.get(stateFileString);
        this.load();
    }

    public synchronized Instant get(String jobName) {
        return this.lastRuns.get(jobName);
    }

    public synchronized void save(String jobName, Instant startedAt) throws FileOperationException {
        Instant previous = this.lastRuns.get(jobName);
        // 只前进, 不回退
        if (previous != null && previous.isAfter(startedAt)) {
            return;
        }
        this.lastRuns.put(jobName, startedAt);
        this.persist();
    }

    private void load() {
        if (this.stateFile == null || !Files.isRegularFile(this.stateFile)) {
            return;
        }
        try {
            String json = Files.readString(this.stateFile, StandardCharsets.UTF_8);
            if (StringUtils.isNotBlank(json)) {
                this.lastRuns.putAll(JsonUtil.deserialize(json, new TypeReference<Map<String, Instant>>() {}));
            }
            log.info("last run state loaded from {}. {} job(s)", this.stateFile, this.lastRuns.size());
        } catch (IOException | RuntimeException e) {
            // 状态文件损坏时所有 job 视为从未运行
            log.warn("last run state {} unreadable, starting without it", this.stateFile, e);
        }
    }

    // 先写临时文件再替换
    private void persist() throws FileOperationException {
        if (this.stateFile == null) {
            return;
        }
        Path parent = this.stateFile.toAbsolutePath().getParent();
        if (parent != null) {
            FilesystemUtil.ensureFolder(parent);
        }
        Path tmpFile = this.stateFile.resolveSibling(this.stateFile.getFileName() + ".tmp");
        try {
            Files.writeString(tmpFile, JsonUtil.serializeToString(this.lastRuns), StandardCharsets.UTF_8);
            Files.move(tmpFile, this.stateFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new FileOperationException("persist failed. stateFile is %s".formatted(this.stateFile), e);
        }
    }
}
