package com.tlmbackup.server.service.dump;

import com.tlmbackup.server.enums.DatabaseEngineEnum;
import com.tlmbackup.server.exception.ConnectionException;
import com.tlmbackup.server.exception.DumpException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.config.BackupSettings;
import com.tlmbackup.server.model.config.DatabaseTarget;
import com.tlmbackup.server.model.internal.CommandResult;
import com.tlmbackup.server.model.internal.DumpArtifact;
import com.tlmbackup.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dumps a MySQL/MariaDB database with the {@code mysqldump} client.
 * The password is handed over through {@code MYSQL_PWD} so it never shows up in the process list.
 */
@Slf4j
@Service
public class MysqlDumper implements DatabaseDumper {

    // 2002/2003/2005: 无法连接, 1045: 认证失败
    private static final Pattern CONNECTION_FAILURE = Pattern.compile(
            "\\b(2002|2003|2005|1045)\\b|Can't connect|Access denied|Unknown MySQL server host",
            Pattern.CASE_INSENSITIVE);

    private final DumpCommandRunner dumpCommandRunner;

    private final BackupSettings.Dump dumpSettings;

    @Autowired
    public MysqlDumper(DumpCommandRunner dumpCommandRunner, BackupSettings backupSettings) {
        this.dumpCommandRunner = dumpCommandRunner;
        this.dumpSettings = backupSettings.getDump();
    }

    @Override
    public DatabaseEngineEnum getEngine() {
        return DatabaseEngineEnum.MYSQL;
    }

    @Override
    public DumpArtifact dump(DatabaseTarget target, String databaseName, Path outputFile)
            throws ConnectionException, DumpException {
        // 检查参数
        if (ObjectUtils.anyNull(target, outputFile) || StringUtils.isBlank(databaseName)) {
            throw new ValidationException("mysql dump failed. target, databaseName or outputFile is null");
        }
        CommandLine commandLine = this.buildCommandLine(target, databaseName);
        Map<String, String> env = new HashMap<>();
        if (StringUtils.isNotEmpty(target.getPassword())) {
            env.put("MYSQL_PWD", target.getPassword());
        }
        log.debug("mysql dump. target is {}, database is {}, output is {}", target.getName(), databaseName, outputFile);
        CommandResult commandResult = this.dumpCommandRunner.run(
                commandLine,
                env,
                outputFile,
                Duration.ofSeconds(this.dumpSettings.getTimeoutSec()));
        if (commandResult.isSuccess()) {
            return new DumpArtifact(databaseName, outputFile, FilesystemUtil.size(outputFile));
        }
        // 失败时删除不完整的 dump 文件
        FilesystemUtil.deleteQuietly(outputFile);
        if (commandResult.isKilled()) {
            throw new DumpException("mysql dump of %s on %s killed after %ds timeout"
                    .formatted(databaseName, target.getName(), this.dumpSettings.getTimeoutSec()));
        }
        String stderr = commandResult.getStderr();
        if (isConnectionFailure(stderr)) {
            throw new ConnectionException("cannot connect to %s (%s:%d). %s"
                    .formatted(target.getName(), target.getHost(), target.getPortOrDefault(), stderr));
        }
        throw new DumpException("mysql dump of %s on %s failed. exit code %d (%s). %s".formatted(
                databaseName,
                target.getName(),
                commandResult.getExitCode(),
                commandResult.getExitCodeEnum().getMessage(),
                stderr));
    }

    CommandLine buildCommandLine(DatabaseTarget target, String databaseName) {
        CommandLine commandLine = new CommandLine(this.dumpSettings.getMysqldumpPath());
        commandLine.addArgument("--host=" + target.getHost(), false);
        commandLine.addArgument("--port=" + target.getPortOrDefault(), false);
        if (StringUtils.isNotBlank(target.getUsername())) {
            commandLine.addArgument("--user=" + target.getUsername(), false);
        }
        if (CollectionUtils.isNotEmpty(this.dumpSettings.getExtraArgs())) {
            for (String extraArg : this.dumpSettings.getExtraArgs()) {
                commandLine.addArgument(extraArg, false);
            }
        }
        commandLine.addArgument(databaseName, false);
        return commandLine;
    }

    static boolean isConnectionFailure(String stderr) {
        return StringUtils.isNotBlank(stderr) && CONNECTION_FAILURE.matcher(stderr).find();
    }
}
