package org.carball.ckmetrics.scanner;

import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.parser.Language;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds source files under one or more roots.
 *
 * <p>Dependency, build-output and hidden directories are pruned. Symbolic links are never
 * followed. Files come back sorted by path so repeated scans agree.</p>
 */
@Slf4j
public class SourceScanner {

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            ".git", "node_modules", "vendor", "target", "build", "dist", "__pycache__", ".venv");

    public List<Path> scan(Collection<Path> roots) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            files.addAll(scan(root));
        }
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort(null);
        return sorted;
    }

    /**
     * @throws NoSuchFileException if {@code root} does not exist
     */
    public List<Path> scan(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(root.toString(), null, "source path not found");
        }
        if (Files.isRegularFile(root, LinkOption.NOFOLLOW_LINKS)) {
            return isSourceFile(root) ? List.of(root) : List.of();
        }
        if (!Files.isReadable(root)) {
            throw new IOException("Source path is not readable: " + root);
        }

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(dir)) {
                    log.debug("Skipping directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isSourceFile(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot read {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(null);
        log.debug("Found {} source files under {}", files.size(), root);
        return files;
    }

    private static boolean isExcluded(Path dir) {
        Path name = dir.getFileName();
        if (name == null) {
            return false;
        }
        String dirName = name.toString();
        return EXCLUDED_DIRECTORIES.contains(dirName) || dirName.startsWith(".");
    }

    private static boolean isSourceFile(Path file) {
        return Language.detect(file) != Language.UNKNOWN;
    }
}
