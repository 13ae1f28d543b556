package com.tlmbackup.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TlmBackupServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TlmBackupServerApplication.class, args);
    }

}
