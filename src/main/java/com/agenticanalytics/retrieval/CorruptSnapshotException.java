package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.nio.file.Path;

public class CorruptSnapshotException extends IOException {
    private final Path path;

    public CorruptSnapshotException(Path path, String reason) {
        super("Corrupt index snapshot " + path + ": " + reason);
        this.path = path;
    }

    public CorruptSnapshotException(Path path, Throwable cause) {
        super("Corrupt index snapshot " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
