package org.carball.ckmetrics.fileproc;

import java.nio.file.Path;

/**
 * A file the processor could not handle. The batch carries on without it.
 */
public record ProcessingError(
    Path path,
    String message,
    Throwable cause
) {

    public static ProcessingError of(Path path, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProcessingError(path, message, cause);
    }
}
