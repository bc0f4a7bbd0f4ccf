package org.carball.ckmetrics.fileproc;

import java.nio.file.Path;
import java.util.List;

/**
 * Naming-convention heuristic for test sources across the supported ecosystems.
 */
public final class TestFiles {

    private static final List<String> TEST_SUFFIXES = List.of(
            "_test.go",
            "_test.py",
            ".test.ts", ".test.js", ".test.tsx", ".test.jsx",
            ".spec.ts", ".spec.js", ".spec.tsx", ".spec.jsx",
            "_test.rb", "_spec.rb",
            "Test.java",
            "Tests.cs", "Test.cs",
            "Test.php"
    );

    private static final List<String> TEST_DIRECTORIES = List.of("tests", "test", "__tests__", "spec");

    private TestFiles() {
    }

    public static boolean isTestFile(Path path) {
        if (path == null) {
            return false;
        }
        String fullPath = path.toString();
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();

        for (String suffix : TEST_SUFFIXES) {
            if (fullPath.endsWith(suffix)) {
                return true;
            }
        }
        // test_foo.py, test_foo.rb
        if (fileName.startsWith("test_")) {
            return true;
        }
        if (fileName.startsWith("Test") && fileName.endsWith(".java")) {
            return true;
        }

        String normalized = fullPath.replace('\\', '/');
        for (String directory : TEST_DIRECTORIES) {
            if (normalized.contains("/" + directory + "/")) {
                return true;
            }
        }
        return false;
    }
}
