package com.blockflow.blockflow_engine.model.dto;

import com.blockflow.blockflow_engine.model.domain.Edge;

/**
 * Incoming edge; {@code branch} names the router/condition outcome the edge belongs to.
 */
public record EdgeDto(
    String id,
    String source,
    String target,
    String branch
) {
    public Edge toEdge() {
        return Edge.builder()
                .id(id)
                .source(source)
                .target(target)
                .branch(branch != null && !branch.isBlank() ? branch : null)
                .build();
    }
}
