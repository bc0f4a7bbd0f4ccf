package org.carball.ckmetrics.parser;

import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Parses source files with tree-sitter. One tree-sitter parser is cached per language.
 * Instances are not thread-safe; give each worker thread its own.
 */
@Slf4j
public class SourceParser implements AutoCloseable {

    private final Map<Language, TSParser> parsers = new EnumMap<>(Language.class);

    public ParseResult parseFile(Path path) throws SourceParseException {
        Language language = Language.detect(path);
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException(path, "cannot read file: " + e.getMessage(), e);
        }
        return parse(content, language, path);
    }

    public ParseResult parse(String content, Language language, Path path) throws SourceParseException {
        if (!language.isObjectOriented()) {
            throw new SourceParseException(path, "no grammar available for language " + language);
        }

        TSParser parser = parserFor(language);
        TSTree tree;
        try {
            tree = parser.parseString(null, content);
        } catch (RuntimeException e) {
            throw new SourceParseException(path, "parser failure: " + e.getMessage(), e);
        }
        if (tree == null || SyntaxTrees.isAbsent(tree.getRootNode())) {
            throw new SourceParseException(path, "parser produced no syntax tree");
        }
        if (tree.getRootNode().hasError()) {
            log.debug("Syntax errors in {}, continuing with partial tree", path);
        }

        return new ParseResult(path, language, content.getBytes(StandardCharsets.UTF_8), tree);
    }

    private TSParser parserFor(Language language) {
        return parsers.computeIfAbsent(language, lang -> {
            TSParser parser = new TSParser();
            parser.setLanguage(lang.grammar());
            return parser;
        });
    }

    /**
     * Drops the cached parsers; native memory is reclaimed once they are unreachable.
     */
    @Override
    public void close() {
        parsers.clear();
    }
}
