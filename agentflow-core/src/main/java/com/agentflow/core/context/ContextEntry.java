package com.agentflow.core.context;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A single write to the context bus.
 *
 * @param sequence Global write order within the bus; higher is more recent
 */
public record ContextEntry(
    ContextKey key,
    JsonNode value,
    long sequence,
    Instant writtenAt
) {
}
