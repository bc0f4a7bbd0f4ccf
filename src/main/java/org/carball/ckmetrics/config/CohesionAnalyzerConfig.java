package org.carball.ckmetrics.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class CohesionAnalyzerConfig {

    @Builder.Default
    private boolean skipTestFiles = true;

    // Bytes; zero or less disables the limit
    @Builder.Default
    private long maxFileSize = 0;

    @Builder.Default
    private int workerThreads = defaultWorkerThreads();

    // When false the inheritance pass reads every file so DIT/NOC see the whole hierarchy
    @Builder.Default
    private boolean sizeLimitAppliesToInheritance = false;

    public static CohesionAnalyzerConfig defaults() {
        return CohesionAnalyzerConfig.builder().build();
    }

    public static int defaultWorkerThreads() {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    /**
     * Rejects values the analyzer cannot run with and logs warnings for odd ones.
     */
    public void validate() {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker thread count must be at least 1, got " + workerThreads);
        }
        if (maxFileSize < 0) {
            log.warn("Negative max file size ({}) disables the limit", maxFileSize);
        }
        if (workerThreads > Runtime.getRuntime().availableProcessors() * 8) {
            log.warn("Worker thread count ({}) is far above the {} available processors",
                    workerThreads, Runtime.getRuntime().availableProcessors());
        }
        if (sizeLimitAppliesToInheritance && maxFileSize <= 0) {
            log.debug("Inheritance size limit requested but no max file size is set");
        }
    }

    public String getConfigurationSummary() {
        return String.format("Tests: %s | Max file size: %s | Workers: %d",
                skipTestFiles ? "skipped" : "included",
                maxFileSize > 0 ? maxFileSize + " bytes" : "unlimited",
                workerThreads);
    }
}
