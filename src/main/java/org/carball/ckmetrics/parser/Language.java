package org.carball.ckmetrics.parser;

import com.fasterxml.jackson.annotation.JsonValue;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPhp;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRuby;
import org.treesitter.TreeSitterTypescript;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Source languages recognised by file extension. Only languages with a class system
 * carry a grammar; the rest are detected so they can be skipped cheaply.
 *
 * <p>TSX has no grammar of its own and is read with the TypeScript one. JSX elements in a
 * {@code .tsx} file come back as error nodes while the surrounding classes still parse.
 * {@code .jsx} goes to the JavaScript grammar, which understands JSX.</p>
 */
public enum Language {
    JAVA("java", TreeSitterJava::new),
    PYTHON("python", TreeSitterPython::new),
    TYPESCRIPT("typescript", TreeSitterTypescript::new),
    TSX("tsx", TreeSitterTypescript::new),
    JAVASCRIPT("javascript", TreeSitterJavascript::new),
    CSHARP("csharp", TreeSitterCSharp::new),
    CPP("cpp", TreeSitterCpp::new),
    RUBY("ruby", TreeSitterRuby::new),
    PHP("php", TreeSitterPhp::new),
    GO("go", null),
    RUST("rust", null),
    C("c", null),
    BASH("bash", null),
    UNKNOWN("unknown", null);

    private final String tag;
    private final Supplier<TSLanguage> grammar;

    Language(String tag, Supplier<TSLanguage> grammar) {
        this.tag = tag;
        this.grammar = grammar;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public boolean isObjectOriented() {
        return grammar != null;
    }

    /**
     * Creates a fresh grammar handle for this language.
     *
     * @throws IllegalStateException if the language has no bundled grammar
     */
    public TSLanguage grammar() {
        if (grammar == null) {
            throw new IllegalStateException("No grammar bundled for language: " + tag);
        }
        return grammar.get();
    }

    public static Language fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        for (Language language : values()) {
            if (language.tag.equalsIgnoreCase(tag.trim())) {
                return language;
            }
        }
        return UNKNOWN;
    }

    public static Language detect(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.equals("dockerfile")) {
            return BASH;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        switch (fileName.substring(dot)) {
            case ".java":
                return JAVA;
            case ".py":
            case ".pyw":
            case ".pyi":
                return PYTHON;
            case ".ts":
                return TYPESCRIPT;
            case ".tsx":
                return TSX;
            case ".js":
            case ".jsx":
            case ".mjs":
            case ".cjs":
                return JAVASCRIPT;
            case ".cs":
                return CSHARP;
            case ".cpp":
            case ".cc":
            case ".cxx":
            case ".hpp":
            case ".hxx":
                return CPP;
            case ".rb":
                return RUBY;
            case ".php":
                return PHP;
            case ".go":
                return GO;
            case ".rs":
                return RUST;
            case ".c":
            case ".h":
                return C;
            case ".sh":
            case ".bash":
                return BASH;
            default:
                return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return tag;
    }
}
