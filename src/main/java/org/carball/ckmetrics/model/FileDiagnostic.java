package org.carball.ckmetrics.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.nio.file.Path;

/**
 * A file left out of the analysis and the reason it was dropped.
 */
public record FileDiagnostic(
    @JsonSerialize(using = ToStringSerializer.class) Path path,
    Phase phase,
    String message
) {

    public enum Phase {
        INHERITANCE,
        METRICS
    }
}
