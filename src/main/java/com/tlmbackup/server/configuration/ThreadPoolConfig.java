package com.tlmbackup.server.configuration;

import com.tlmbackup.server.model.config.BackupSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    // tick 和 job 超时检测共用这一个线程
    @Bean(name = "schedulerTickScheduler")
    public ThreadPoolTaskScheduler schedulerTickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("Scheduler-Tick-Thread-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Every run gets a thread right away: there is no queue, so a stuck run never delays
     * another due job. Runs are bounded by the one-in-flight-per-job rule.
     */
    @Bean(name = "backupJobExecutor")
    public ThreadPoolTaskExecutor backupJobExecutor(BackupSettings backupSettings) {
        int coreJobThreads = backupSettings.getScheduler().getCoreJobThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreJobThreads);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Backup-Job-Thread-");
        // 关闭时中断 worker, 正在运行的 dump 进程会被销毁
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("backupJobExecutor initialized with {} core thread(s)", coreJobThreads);
        return executor;
    }

    @Bean(name = "uploadExecutor")
    public ThreadPoolTaskExecutor uploadExecutor(BackupSettings backupSettings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(backupSettings.getUpload().getQueueCapacity());
        executor.setThreadNamePrefix("Upload-Thread-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // 没有队列, 超过 maxStreams 的订阅直接拒绝
    @Bean(name = "eventStreamExecutor")
    public ThreadPoolTaskExecutor eventStreamExecutor(BackupSettings backupSettings) {
        int maxStreams = backupSettings.getEvents().getMaxStreams();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxStreams);
        executor.setMaxPoolSize(maxStreams);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("Event-Stream-Thread-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
