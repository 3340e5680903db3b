package com.raditha.leakage.trace;

import java.util.List;

/**
 * All entries of one testcase's trace, in execution order.
 *
 * @param testcaseId testcase ID assigned by the test generation layer
 * @param entries    trace entries
 */
public record ParsedTrace(int testcaseId, List<TraceEntry> entries) {
    public ParsedTrace {
        if (testcaseId < 0) {
            throw new IllegalArgumentException("testcaseId must be >= 0");
        }
        entries = List.copyOf(entries);
    }
}
