package com.tlmbackup.server.model.internal;

import lombok.Value;

import java.nio.file.Path;

@Value
public class DumpArtifact {

    String databaseName;

    Path path;

    long bytes;
}
