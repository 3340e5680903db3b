package com.raditha.leakage.pipeline;

import com.raditha.leakage.config.AnalysisConfig;
import com.raditha.leakage.config.ErrorPolicy;
import com.raditha.leakage.merge.CallTreeMerger;
import com.raditha.leakage.trace.ParsedTrace;
import com.raditha.leakage.trace.TraceFileParser;
import com.raditha.leakage.trace.TraceFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Parses trace files in parallel and merges them into one call tree.
 * <p>
 * A pool of parser threads feeds a bounded queue; the calling thread is the
 * only consumer and merges one testcase at a time. A full queue blocks the
 * parsers until the merger catches up.
 * <p>
 * The order in which testcases are merged follows parse completion. The
 * resulting partitions do not depend on it.
 */
public class TraceMergePipeline {

    private static final Logger logger = LoggerFactory.getLogger(TraceMergePipeline.class);

    static final String TRACE_FILE_SUFFIX = ".trace";

    private final AnalysisConfig config;
    private final TraceFileParser parser;
    private final CallTreeMerger merger;
    private volatile boolean cancelled;

    public TraceMergePipeline(AnalysisConfig config) {
        this(config, new TraceFileParser(), new CallTreeMerger());
    }

    public TraceMergePipeline(AnalysisConfig config, TraceFileParser parser, CallTreeMerger merger) {
        this.config = config;
        this.parser = parser;
        this.merger = merger;
    }

    /**
     * Result of one parser task. Exactly one of trace and failure is set.
     */
    private record Work(Path file, ParsedTrace trace, Exception failure) {
    }

    /**
     * Lists the trace files ({@code *.trace}) of a directory, ordered by
     * testcase ID and then by name.
     */
    public static List<Path> listTraceFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Trace directory not found: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TRACE_FILE_SUFFIX))
                    .sorted(Comparator.comparingLong(TraceMergePipeline::sortKey)
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    private static long sortKey(Path file) {
        try {
            return TraceFileParser.testcaseIdFromFileName(file);
        } catch (TraceFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Merges all trace files of the given directory.
     */
    public PipelineResult run(Path traceDirectory) throws IOException, TraceFormatException, InterruptedException {
        return run(listTraceFiles(traceDirectory));
    }

    /**
     * Parses and merges the given trace files.
     *
     * @throws TraceFormatException if a trace is invalid and the error policy
     *                              is {@link ErrorPolicy#ABORT}
     * @throws IOException          if a trace file cannot be read
     * @throws InterruptedException if the calling thread is interrupted
     */
    public PipelineResult run(List<Path> traceFiles)
            throws IOException, TraceFormatException, InterruptedException {
        logger.info("Merging {} trace files using {} parser threads", traceFiles.size(), config.parserThreads());

        BlockingQueue<Work> queue = new ArrayBlockingQueue<>(config.queueCapacity());
        ExecutorService executor = Executors.newFixedThreadPool(config.parserThreads());
        List<SkippedTrace> skipped = new ArrayList<>();
        int merged = 0;
        boolean stopped = false;
        try {
            for (Path file : traceFiles) {
                executor.submit(() -> parseInto(file, queue));
            }
            executor.shutdown();

            for (int received = 0; received < traceFiles.size(); received++) {
                if (cancelled) {
                    logger.info("Cancelled after merging {} of {} testcases", merged, traceFiles.size());
                    stopped = true;
                    break;
                }

                Work work = queue.take();
                try {
                    if (work.failure() != null) {
                        throw work.failure();
                    }
                    merge(work.trace());
                    ++merged;
                    if (merged % 100 == 0) {
                        logger.info("Merged {} of {} testcases", merged, traceFiles.size());
                    }
                } catch (TraceFormatException e) {
                    if (config.errorPolicy() == ErrorPolicy.ABORT) {
                        throw e;
                    }
                    logger.warn("Skipping {}: {}", work.file(), e.getMessage());
                    skipped.add(new SkippedTrace(work.file(), e.getMessage()));
                } catch (IOException | RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Unexpected parser failure for " + work.file(), e);
                }
            }
        } finally {
            executor.shutdownNow();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Parser threads did not terminate");
            }
        }

        logger.info("Merged {} testcases, skipped {}", merged, skipped.size());
        return new PipelineResult(merger.getRoot(), merged, skipped, stopped, merger.getStatistics());
    }

    private void merge(ParsedTrace trace) throws TraceFormatException {
        try {
            merger.mergeTrace(trace.testcaseId(), trace.entries());
        } catch (IllegalArgumentException e) {
            // Two files mapping to the same testcase ID
            throw new TraceFormatException(e.getMessage(), e);
        }
    }

    private void parseInto(Path file, BlockingQueue<Work> queue) {
        Work work;
        try {
            work = new Work(file, parser.parse(file), null);
        } catch (IOException | TraceFormatException | RuntimeException e) {
            work = new Work(file, null, e);
        }

        try {
            queue.put(work);
        } catch (InterruptedException e) {
            // Shut down by the consumer
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops the run before the next testcase is merged. The testcases merged
     * so far stay in the tree.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public CallTreeMerger getMerger() {
        return merger;
    }
}
