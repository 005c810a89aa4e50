package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.HandlerNotFoundException;
import com.blockflow.blockflow_engine.model.domain.Block;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed, ordered list of handlers. The first handler whose {@code canHandle} accepts a block
 * runs it; handler priority comes from each bean's {@code @Order}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockHandlerRegistry {

    private final List<BlockHandler> handlers;
    private final List<BlockHandler> ordered = new ArrayList<>();

    @PostConstruct
    public void init() {
        ordered.addAll(handlers);
        AnnotationAwareOrderComparator.sort(ordered);
        log.debug("Block handlers in priority order: {}",
                ordered.stream().map(h -> h.getClass().getSimpleName()).toList());
    }

    public BlockHandler resolve(Block block) {
        for (BlockHandler handler : ordered) {
            if (handler.canHandle(block)) {
                return handler;
            }
        }
        throw new HandlerNotFoundException(block.getId(), block.getKind());
    }

    public boolean supports(Block block) {
        return ordered.stream().anyMatch(h -> h.canHandle(block));
    }
}
