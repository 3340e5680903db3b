package com.raditha.leakage.scoring;

import com.raditha.leakage.model.InstructionIds;

/**
 * Identity of a divergence site: an instruction within a call stack.
 * All divergences observed for the same instruction in the same call stack
 * are aggregated into one site.
 *
 * @param callStackId   ID of the innermost enclosing call, 0 at top level
 * @param instructionId instruction whose outcome diverged (allocation ID for
 *                      allocations)
 * @param type          kind of divergence
 */
public record LeakageSite(long callStackId, long instructionId, LeakageType type) {

    /**
     * Renders the instruction as {@code image+offset}, or {@code alloc#id} for
     * allocations.
     */
    public String formatInstruction() {
        return type == LeakageType.ALLOCATION ? "alloc#" + instructionId : InstructionIds.format(instructionId);
    }

    @Override
    public String toString() {
        return String.format("CS-%016X/%s (%s)", callStackId, formatInstruction(), type.getLabel());
    }
}
