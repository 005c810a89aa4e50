package com.blockflow.blockflow_engine.model.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Edge {

    String id;

    String source;

    String target;

    // Router/condition outcome this edge belongs to; null means the edge is unconditional
    String branch;

    /** True when this edge should be followed after its source selected {@code selectedBranch}. */
    public boolean matches(String selectedBranch) {
        if (selectedBranch == null) return false;
        return selectedBranch.equals(branch) || selectedBranch.equals(target);
    }
}
