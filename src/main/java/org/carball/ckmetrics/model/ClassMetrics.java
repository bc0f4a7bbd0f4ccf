package org.carball.ckmetrics.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Builder;
import lombok.Value;
import org.carball.ckmetrics.parser.Language;

import java.nio.file.Path;
import java.util.List;

/**
 * CK metrics for one class-like declaration.
 */
@Value
@Builder
@JsonPropertyOrder({"path", "className", "language", "startLine", "endLine",
        "wmc", "cbo", "rfc", "lcom", "dit", "noc", "nom", "nof", "loc",
        "methods", "fields", "coupledClasses"})
public class ClassMetrics {

    @JsonSerialize(using = ToStringSerializer.class)
    Path path;
    String className;
    Language language;
    int startLine;
    int endLine;

    // Weighted methods per class: sum of method cyclomatic complexity
    int wmc;
    // Coupling between objects: distinct referenced type names
    int cbo;
    // Response for class: own methods plus distinct called names
    int rfc;
    // LCOM4: connected components of the method/field usage graph
    int lcom;
    int dit;
    int noc;

    @Builder.Default
    List<String> methods = List.of();
    @Builder.Default
    List<String> fields = List.of();
    @Builder.Default
    List<String> coupledClasses = List.of();

    public int getNom() {
        return methods.size();
    }

    public int getNof() {
        return fields.size();
    }

    public int getLoc() {
        return endLine - startLine + 1;
    }
}
