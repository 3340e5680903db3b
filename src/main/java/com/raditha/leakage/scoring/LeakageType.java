package com.raditha.leakage.scoring;

/**
 * Kind of instruction whose behaviour diverged between testcases.
 */
public enum LeakageType {
    JUMP("jump"),
    CALL("call"),
    RETURN("return"),
    MEMORY_ACCESS("memory access"),
    ALLOCATION("allocation");

    private final String label;

    LeakageType(String label) {
        this.label = label;
    }

    /**
     * Label used in reports, e.g. {@code memory access}.
     */
    public String getLabel() {
        return label;
    }

    /**
     * True for the control flow kinds (jump, call, return).
     */
    public boolean isControlFlow() {
        return this == JUMP || this == CALL || this == RETURN;
    }
}
