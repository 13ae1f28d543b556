package com.tlmbackup.server.model.api.status;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigSummary {

    private int databaseConnections;

    private int backupJobs;

    private boolean uploadConfigured;

    private String backupDirectory;
}
