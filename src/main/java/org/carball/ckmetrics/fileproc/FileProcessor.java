package org.carball.ckmetrics.fileproc;

import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.parser.SourceParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a per-file task over a bounded worker pool.
 *
 * <p>Every worker thread owns a {@link SourceParser}, handed to the task so a file is
 * parsed with a parser no other thread touches. Results come back in input order no
 * matter which worker finished first. Failures are collected per file and never abort
 * the batch.</p>
 */
@Slf4j
public class FileProcessor implements AutoCloseable {

    /**
     * Work applied to one file. Returning {@code null} contributes no result.
     */
    @FunctionalInterface
    public interface FileTask<T> {
        T process(SourceParser parser, Path file) throws Exception;
    }

    public record MapResult<T>(List<T> results, List<ProcessingError> errors) {

        public MapResult {
            results = List.copyOf(results);
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    private final int workerThreads;
    private final ExecutorService executor;
    private final Set<SourceParser> parsers = ConcurrentHashMap.newKeySet();
    private final ThreadLocal<SourceParser> threadParser = ThreadLocal.withInitial(this::newParser);

    public FileProcessor(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker thread count must be at least 1, got " + workerThreads);
        }
        this.workerThreads = workerThreads;
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        log.debug("Started file processor with {} worker threads", workerThreads);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public <T> MapResult<T> mapFiles(List<Path> files, FileTask<T> task) {
        return run(files, 0, task, null);
    }

    /**
     * Like {@link #mapFiles} but files larger than {@code maxFileSize} bytes are reported
     * as errors instead of processed. A limit of zero or less disables the check.
     * {@code onProgress} runs once per input file, processed or not, from the worker
     * thread that handled it.
     */
    public <T> MapResult<T> mapFilesWithSizeLimit(List<Path> files, long maxFileSize,
                                                  FileTask<T> task, Runnable onProgress) {
        return run(files, maxFileSize, task, onProgress);
    }

    private <T> MapResult<T> run(List<Path> files, long maxFileSize, FileTask<T> task, Runnable onProgress) {
        List<Future<T>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(executor.submit(() -> {
                try {
                    checkSize(file, maxFileSize);
                    return task.process(threadParser.get(), file);
                } finally {
                    if (onProgress != null) {
                        onProgress.run();
                    }
                }
            }));
        }

        List<T> results = new ArrayList<>();
        List<ProcessingError> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Path file = files.get(i);
            try {
                T result = futures.get(i).get();
                if (result != null) {
                    results.add(result);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Skipping {}: {}", file, cause.getMessage());
                log.debug("Failure detail for {}", file, cause);
                errors.add(ProcessingError.of(file, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for file results", e);
            }
        }
        return new MapResult<>(results, errors);
    }

    private static void checkSize(Path file, long maxFileSize) throws IOException {
        if (maxFileSize <= 0) {
            return;
        }
        long size = Files.size(file);
        if (size > maxFileSize) {
            throw new FileTooLargeException(file, size, maxFileSize);
        }
    }

    private SourceParser newParser() {
        SourceParser parser = new SourceParser();
        parsers.add(parser);
        return parser;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        parsers.forEach(SourceParser::close);
        parsers.clear();
    }

    /**
     * Raised inside a worker for files over the configured size limit.
     */
    public static class FileTooLargeException extends IOException {
        public FileTooLargeException(Path file, long size, long limit) {
            super(String.format("file size %d bytes exceeds limit of %d bytes", size, limit));
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ck-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
