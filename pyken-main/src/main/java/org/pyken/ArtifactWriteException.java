package org.pyken;

import java.nio.file.Path;

public class ArtifactWriteException extends PyKenException {

    private final Path target;

    public ArtifactWriteException(Path target, Throwable cause) {
        this("Failed to write artifact " + target + ": " + cause.getMessage(), target, cause);
    }

    public ArtifactWriteException(String message, Path target, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
