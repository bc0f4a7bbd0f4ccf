package org.carball.ckmetrics.graph;

import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.fileproc.FileProcessor;
import org.carball.ckmetrics.language.CapabilityTable;
import org.carball.ckmetrics.language.LanguageCapabilities;
import org.carball.ckmetrics.language.TypeNames;
import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.ParseResult;
import org.carball.ckmetrics.parser.SourceParseException;
import org.carball.ckmetrics.parser.SourceParser;
import org.carball.ckmetrics.parser.SyntaxTrees;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * First analysis pass: collects every class declaration and its direct parents across all
 * files, then folds them into one {@link InheritanceGraph}.
 *
 * <p>Files are parsed in parallel; the fold runs on the calling thread after every file
 * is done, so the graph is complete before anyone reads it.</p>
 */
@Slf4j
public class InheritanceGraphBuilder {

    private final FileProcessor fileProcessor;

    public InheritanceGraphBuilder(FileProcessor fileProcessor) {
        this.fileProcessor = fileProcessor;
    }

    public Result build(List<Path> files) {
        return build(files, 0);
    }

    /**
     * @param maxFileSize files above this many bytes are skipped; zero or less means no limit
     */
    public Result build(List<Path> files, long maxFileSize) {
        log.info("Building inheritance graph from {} files", files.size());

        FileProcessor.MapResult<List<ClassFact>> mapped = maxFileSize > 0
                ? fileProcessor.mapFilesWithSizeLimit(files, maxFileSize, InheritanceGraphBuilder::collect, null)
                : fileProcessor.mapFiles(files, InheritanceGraphBuilder::collect);

        List<ClassFact> facts = new ArrayList<>();
        mapped.results().forEach(facts::addAll);
        InheritanceGraph graph = InheritanceGraph.of(facts);

        log.info("Inheritance graph holds {} classes ({} files skipped)", graph.size(), mapped.errors().size());
        return new Result(graph, mapped);
    }

    private static List<ClassFact> collect(SourceParser parser, Path file) throws SourceParseException {
        if (!CapabilityTable.isApplicable(Language.detect(file))) {
            return List.of();
        }
        return factsOf(parser.parseFile(file));
    }

    /**
     * Class facts for one parsed file, nested declarations included.
     */
    public static List<ClassFact> factsOf(ParseResult parsed) {
        LanguageCapabilities capabilities = CapabilityTable.forLanguage(parsed.language());
        List<ClassFact> facts = new ArrayList<>();
        if (!capabilities.isApplicable()) {
            return facts;
        }

        byte[] source = parsed.source();
        SyntaxTrees.walk(parsed.root(), node -> {
            if (!capabilities.isClassDeclaration(node)) {
                return true;
            }
            String name = SyntaxTrees.text(SyntaxTrees.field(node, "name"), source).trim();
            if (name.isEmpty()) {
                return true;
            }
            facts.add(new ClassFact(name, cleanParents(capabilities.parentsOf(node, source)), parsed.path()));
            return true;
        });
        return facts;
    }

    static List<String> cleanParents(List<String> rawParents) {
        List<String> parents = new ArrayList<>();
        for (String raw : rawParents) {
            String cleaned = TypeNames.clean(raw);
            if (!cleaned.isEmpty() && !TypeNames.isPrimitive(cleaned)) {
                parents.add(cleaned);
            }
        }
        return parents;
    }

    /**
     * The graph plus whatever the pass could not read.
     */
    public record Result(InheritanceGraph graph, FileProcessor.MapResult<List<ClassFact>> mapResult) {
    }
}
