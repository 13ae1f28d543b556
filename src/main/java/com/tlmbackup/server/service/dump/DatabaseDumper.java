package com.tlmbackup.server.service.dump;

import com.tlmbackup.server.enums.DatabaseEngineEnum;
import com.tlmbackup.server.exception.ConnectionException;
import com.tlmbackup.server.exception.DumpException;
import com.tlmbackup.server.model.config.DatabaseTarget;
import com.tlmbackup.server.model.internal.DumpArtifact;

import java.nio.file.Path;

/**
 * Dumps one database of a target into a local file. One blocking call per database.
 * Implementations must give up promptly when the calling thread is interrupted.
 */
public interface DatabaseDumper {

    DatabaseEngineEnum getEngine();

    DumpArtifact dump(DatabaseTarget target, String databaseName, Path outputFile)
            throws ConnectionException, DumpException;
}
