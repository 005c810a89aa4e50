package com.blockflow.blockflow_engine.model.context;

import com.blockflow.blockflow_engine.model.domain.BlockType;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Branches selected by router and condition blocks, keyed by the deciding block id.
 */
@Getter
public class Decisions {

    private final Map<String, String> router = new ConcurrentHashMap<>();
    private final Map<String, String> condition = new ConcurrentHashMap<>();

    public Map<String, String> forType(BlockType type) {
        return switch (type) {
            case ROUTER -> router;
            case CONDITION -> condition;
            default -> throw new IllegalArgumentException("Block type " + type + " does not make decisions");
        };
    }

    /** Selected branch of a decision block, or null while it has not decided. */
    public String selectedBranch(String blockId) {
        String routed = router.get(blockId);
        return routed != null ? routed : condition.get(blockId);
    }

    public void clear(String blockId) {
        router.remove(blockId);
        condition.remove(blockId);
    }
}
