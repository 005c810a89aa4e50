package com.blockflow.blockflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-loop state: lifecycle status, the values being iterated, and one collected result per
 * finished iteration. Keyed by loop block id so nested or sibling loops do not interfere.
 */
@Data
public class LoopState {
    private String loopId;
    private LoopStatus status = LoopStatus.PENDING;

    // forEach: the collection; for: null (the counter is the item)
    private List<Object> items;
    private int totalIterations;

    // 1-based number of the iteration in progress, 0 before the first entry
    private int iteration = 0;

    private List<Object> results = new ArrayList<>();

    /** Output of the body block that finished last in the current iteration. */
    @JsonIgnore
    private Map<String, Object> lastBodyOutput;

    /** Body blocks that finished in the current iteration. */
    @JsonIgnore
    private Set<String> doneThisIteration = new LinkedHashSet<>();

    public LoopState() {}

    public LoopState(String loopId) {
        this.loopId = loopId;
    }

    /** Zero-based index of the iteration in progress. */
    public int index() {
        return Math.max(0, iteration - 1);
    }

    /** Value bound to the iteration in progress: the element in forEach mode, the index otherwise. */
    public Object currentItem() {
        if (items != null) {
            return iteration >= 1 && iteration <= items.size() ? items.get(iteration - 1) : null;
        }
        return index();
    }

    public boolean hasMoreIterations() {
        return iteration < totalIterations;
    }
}
