package com.blockflow.blockflow_engine.model.dto;

import com.blockflow.blockflow_engine.model.domain.Block;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Incoming block. Kind stays a string so tool kinds unknown to the engine deserialize and
 * are reported by graph validation instead of failing JSON binding.
 */
public record BlockDto(
    @NotBlank(message = "block id is required") String id,
    @NotBlank(message = "block kind is required") String kind,
    String name,
    Map<String, Object> config,
    Map<String, Object> inputs,
    Boolean enabled
) {
    public Block toBlock() {
        return Block.builder()
                .id(id)
                .kind(kind)
                .name(name)
                .config(config != null ? config : Map.of())
                .inputs(inputs != null ? inputs : Map.of())
                .enabled(enabled == null || enabled)
                .build();
    }
}
