package org.carball.ckmetrics.fileproc;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class TestFilesTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "src/OrderServiceTest.java",
            "src/TestOrderService.java",
            "pkg/server_test.go",
            "app/test_models.py",
            "app/models_test.py",
            "web/button.test.tsx",
            "web/api.spec.ts",
            "lib/user_spec.rb",
            "Service/RepoTests.cs",
            "src/RepoTest.php",
            "project/tests/helpers.py",
            "project/__tests__/util.js",
            "project/spec/support.rb",
            "project\\test\\Fixture.cs"
    })
    void shouldRecognizeTestFiles(String path) {
        assertThat(TestFiles.isTestFile(Paths.get(path))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "src/OrderService.java",
            "src/Testing.py",
            "app/contest.py",
            "web/latest.ts",
            "lib/inspector.rb",
            "src/attestation/Signer.java"
    })
    void shouldNotFlagProductionFiles(String path) {
        assertThat(TestFiles.isTestFile(Paths.get(path))).isFalse();
    }
}
