package com.tlmbackup.server.service.shutdown;

/**
 * Ends the JVM. Split out so shutdown logic can be tested without exiting.
 */
public interface ProcessTerminator {

    // 正常退出, 执行 shutdown hook
    void exit(int exitCode);

    // 立即退出, 不等待任何任务
    void halt(int exitCode);
}
