package org.strata.diff.core;

import lombok.Builder;
import lombok.Value;
import org.strata.diff.search.FrontierQueueType;

import java.util.Locale;

/**
 * Runtime configuration for a {@link StructuralDiffer}.
 */
@Value
@Builder
public class DiffConfig {
    public static final int DEFAULT_GRAPH_LIMIT = 3_000_000;

    static final String PROP_GRAPH_LIMIT = "strata.diff.graphLimit";
    static final String PROP_QUEUE = "strata.diff.queue";

    /**
     * Maximum number of distinct search vertices before the diff gives up.
     */
    @Builder.Default
    int graphLimit = DEFAULT_GRAPH_LIMIT;

    /**
     * Frontier implementation. Both produce identical results.
     */
    @Builder.Default
    FrontierQueueType queueType = FrontierQueueType.BUCKET;

    /**
     * Records settle distances in pop order, for diagnostics.
     */
    @Builder.Default
    boolean traceDistances = false;

    /**
     * Loads configuration from system properties, falling back to defaults for blank or
     * unparsable values.
     */
    public static DiffConfig defaults() {
        return DiffConfig.builder()
                .graphLimit(readGraphLimit())
                .queueType(readQueueType())
                .build();
    }

    private static int readGraphLimit() {
        String raw = System.getProperty(PROP_GRAPH_LIMIT);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_GRAPH_LIMIT;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_GRAPH_LIMIT;
        } catch (NumberFormatException ex) {
            return DEFAULT_GRAPH_LIMIT;
        }
    }

    private static FrontierQueueType readQueueType() {
        String raw = System.getProperty(PROP_QUEUE);
        if (raw == null || raw.isBlank()) {
            return FrontierQueueType.BUCKET;
        }
        try {
            return FrontierQueueType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return FrontierQueueType.BUCKET;
        }
    }
}
