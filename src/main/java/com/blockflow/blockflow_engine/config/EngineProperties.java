package com.blockflow.blockflow_engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings bound from the {@code blockflow.engine.*} namespace in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "blockflow.engine")
public class EngineProperties {

    /** Hard cap on block dispatches per run; stops runaway loops without killing the process. */
    private int maxBlockExecutions = 5_000;

    private int maxLoopIterations = 1_000;

    /** Iterations of a count-mode loop that does not configure any. */
    private int defaultLoopIterations = 5;

    /** Timeout handed to function_execute when the block does not set one. */
    private long functionTimeoutMs = 5_000L;

    private long defaultToolTimeoutMs = 30_000L;

    /** Added to a tool's own timeout before the engine gives up on the call locally. */
    private long timeoutGraceMs = 1_000L;

    private int toolPoolSize = 8;

    private int runPoolSize = 4;

    /** Finished runs kept in memory; the oldest are dropped first. Running records are never evicted. */
    private int maxRetainedRuns = 1_000;

    /** Block kinds that name an external tool and are run by the generic tool handler. */
    private List<String> tools = new ArrayList<>();

    /** Environment variables every run starts with; run requests may override them. */
    private Map<String, String> environment = new LinkedHashMap<>();

    private ToolService toolService = new ToolService();

    private Cors cors = new Cors();

    @Data
    public static class ToolService {
        private String baseUrl = "http://localhost:3001";
        private String path = "/api/tools/{tool}";
    }

    /** Browser access for the editor: REST under {@code pathPattern} and the /ws STOMP endpoint. */
    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));
        private String pathPattern = "/api/**";
        private boolean allowCredentials = true;
    }
}
