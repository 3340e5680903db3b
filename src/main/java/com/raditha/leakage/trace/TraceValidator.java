package com.raditha.leakage.trace;

import java.util.List;

/**
 * Checks the call/return nesting of a complete trace, so that merging can
 * reject a trace before touching the call tree.
 */
public final class TraceValidator {

    private TraceValidator() {
    }

    /**
     * @throws TraceFormatException if a return has no matching call, or the
     *                              trace ends while calls are still open
     */
    public static void validate(int testcaseId, List<? extends TraceEntry> trace) throws TraceFormatException {
        int depth = 0;
        int index = 0;
        for (TraceEntry entry : trace) {
            if (entry == null) {
                throw new TraceFormatException("Null trace entry", testcaseId, index);
            }
            if (entry instanceof TraceEntry.CallEntry) {
                depth++;
            } else if (entry instanceof TraceEntry.ReturnEntry) {
                if (depth == 0) {
                    throw new TraceFormatException(
                            "Testcase " + testcaseId + ": return at entry " + index + " has no matching call",
                            testcaseId, index);
                }
                depth--;
            }
            index++;
        }

        if (depth != 0) {
            throw new TraceFormatException(
                    "Testcase " + testcaseId + ": trace ends with " + depth + " open call(s)",
                    testcaseId, index);
        }
    }
}
