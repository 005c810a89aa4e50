package com.blockflow.blockflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the run's audit trail. Entries are appended in completion order; a loop-body
 * block contributes one entry per iteration.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlockLog {
    private long sequence;
    private String blockId;
    private String blockKind;
    private String blockName;

    // 1-based iteration of the enclosing loop, null outside loop bodies
    private Integer iteration;

    private boolean success;
    private Instant startedAt;
    private Instant endedAt;
    private long durationMs;

    private Map<String, Object> input;
    private Map<String, Object> output;
    private String error;
}
