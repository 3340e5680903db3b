package com.raditha.leakage.trace;

/**
 * Thrown when a trace is malformed, e.g. when calls and returns are not
 * properly nested or a trace file line cannot be parsed.
 */
public class TraceFormatException extends Exception {

    private final int testcaseId;
    private final int entryIndex;

    public TraceFormatException(String message) {
        this(message, -1, -1);
    }

    public TraceFormatException(String message, int testcaseId, int entryIndex) {
        super(message);
        this.testcaseId = testcaseId;
        this.entryIndex = entryIndex;
    }

    public TraceFormatException(String message, Throwable cause) {
        super(message, cause);
        this.testcaseId = -1;
        this.entryIndex = -1;
    }

    /**
     * Testcase the trace belongs to, or -1 if unknown.
     */
    public int getTestcaseId() {
        return testcaseId;
    }

    /**
     * Index of the offending entry (or line), or -1 if unknown.
     */
    public int getEntryIndex() {
        return entryIndex;
    }
}
