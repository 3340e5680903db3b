package com.raditha.leakage.pipeline;

import java.nio.file.Path;

/**
 * A trace that was rejected under {@link com.raditha.leakage.config.ErrorPolicy#SKIP}.
 *
 * @param file   the trace file
 * @param reason error message
 */
public record SkippedTrace(Path file, String reason) {
}
