package org.carball.ckmetrics.parser;

import java.nio.file.Path;

/**
 * Raised when a file cannot be turned into a syntax tree.
 */
public class SourceParseException extends Exception {

    private final Path path;

    public SourceParseException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public SourceParseException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
