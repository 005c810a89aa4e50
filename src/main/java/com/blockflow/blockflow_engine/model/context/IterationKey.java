package com.blockflow.blockflow_engine.model.context;

/**
 * Identifies one execution of a loop-body block: the block id plus the 1-based iteration
 * of its enclosing loop.
 */
public record IterationKey(String blockId, int iteration) {

    @Override
    public String toString() {
        return blockId + "#" + iteration;
    }
}
