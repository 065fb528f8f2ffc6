package com.wom.openings.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One untouched result from a source. Only the owning adapter and the normalizer look inside {@code body}.
 */
public record RawPayload(
        SourceLabel source,
        JsonNode body
) {}
