package com.blockflow.blockflow_engine.model.context;

import lombok.Data;

/**
 * Per-block retry configuration, stored inside the block config under the "retry" key.
 *
 * <pre>
 * {
 *   "retry": {
 *     "maxRetries": 3,
 *     "backoffMs": 2000,
 *     "backoffMultiplier": 2.0
 *   },
 *   ... other config ...
 * }
 * </pre>
 */
@Data
public class RetryConfig {

    /**
     * How many times to retry after the initial attempt.
     * 0 means no retry. Values are clamped to [0, 10] by the executor.
     */
    private int maxRetries = 0;

    /**
     * Delay in milliseconds before the first retry attempt.
     */
    private long backoffMs = 1000L;

    /**
     * Multiplier applied to the delay after each failed attempt.
     * e.g. 1000ms with 2.0 → 1s, 2s, 4s...
     */
    private double backoffMultiplier = 2.0d;

    /** Backoff before retry number {@code retry} (1-based): backoffMs * multiplier^(retry - 1). */
    public long delayBeforeRetry(int retry) {
        double delay = backoffMs * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        return (long) Math.max(0L, Math.min(delay, Long.MAX_VALUE));
    }
}
