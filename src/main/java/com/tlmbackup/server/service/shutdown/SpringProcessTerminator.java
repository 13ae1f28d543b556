package com.tlmbackup.server.service.shutdown;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class SpringProcessTerminator implements ProcessTerminator {

    private final ApplicationContext applicationContext;

    @Autowired
    public SpringProcessTerminator(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void exit(int exitCode) {
        log.info("exit. closing application context, exit code {}", exitCode);
        System.exit(SpringApplication.exit(this.applicationContext, () -> exitCode));
    }

    @Override
    public void halt(int exitCode) {
        log.warn("halt. forced exit, exit code {}", exitCode);
        Runtime.getRuntime().halt(exitCode);
    }
}
