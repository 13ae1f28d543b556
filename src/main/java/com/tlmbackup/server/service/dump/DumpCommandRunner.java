package com.tlmbackup.server.service.dump;

import com.tlmbackup.server.enums.MysqldumpExitCodeEnum;
import com.tlmbackup.server.exception.DumpException;
import com.tlmbackup.server.exception.ValidationException;
import com.tlmbackup.server.model.internal.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteResultHandler;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs a dump tool with stdout written straight into the dump file and stderr captured.
 * Interrupting the calling thread destroys the process.
 */
@Slf4j
@Component
public class DumpCommandRunner {

    public CommandResult run(
            CommandLine commandLine,
            Map<String, String> extraEnvMap,
            Path stdoutFile,
            Duration timeout) throws ValidationException, DumpException {
        // 检查参数
        if (ObjectUtils.anyNull(commandLine, stdoutFile)) {
            throw new ValidationException("run failed. commandLine or stdoutFile is null");
        }
        Executor executor = DefaultExecutor.builder().get();
        // 1. 设置超时, 同时用于中断时销毁进程
        Duration watchdogTimeout = timeout == null || timeout.isZero() || timeout.isNegative() ?
                ExecuteWatchdog.INFINITE_TIMEOUT_DURATION :
                timeout;
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(watchdogTimeout).get();
        executor.setWatchdog(watchdog);
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        CompletableFuture<Integer> future = new CompletableFuture<>();
        try (OutputStream stdout = Files.newOutputStream(stdoutFile)) {
            // 2. stdout 直接写入 dump 文件
            executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
            // 3. 非阻塞执行
            executor.execute(commandLine, getEnv(extraEnvMap), new ExecuteResultHandler() {
                @Override
                public void onProcessComplete(int exitValue) {
                    future.complete(exitValue);
                }

                @Override
                public void onProcessFailed(ExecuteException e) {
                    future.complete(e.getExitValue());
                }
            });
            // 4. 等待进程结束
            int exitCode = future.get();
            return new CommandResult(
                    exitCode,
                    MysqldumpExitCodeEnum.fromCode(exitCode),
                    stderr.toString(StandardCharsets.UTF_8).trim(),
                    watchdog.killedProcess());
        } catch (InterruptedException e) {
            watchdog.destroyProcess();
            Thread.currentThread().interrupt();
            throw new DumpException("run failed. interrupted, process destroyed. command is %s"
                    .formatted(commandLine.getExecutable()), e);
        } catch (ExecutionException | IOException e) {
            watchdog.destroyProcess();
            throw new DumpException("run failed before command exec. command is %s"
                    .formatted(commandLine.getExecutable()), e);
        }
    }

    private static Map<String, String> getEnv(Map<String, String> extraEnvMap) {
        // 获取当前系统变量
        Map<String, String> result = new HashMap<>(System.getenv());
        if (MapUtils.isNotEmpty(extraEnvMap)) {
            result.putAll(extraEnvMap);
        }
        return result;
    }
}
