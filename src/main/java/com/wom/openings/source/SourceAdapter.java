package com.wom.openings.source;

import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;

import java.util.List;
import java.util.Optional;

public interface SourceAdapter {
    SourceLabel source();

    /**
     * Raw results for this run. Network and parse failures are logged and yield a partial or empty list;
     * only the mandatory primary source may throw.
     */
    List<RawPayload> fetch(QueryContext ctx);

    /** Why the adapter cannot run at all (e.g. a missing credential), or empty when it is usable. */
    default Optional<String> misconfiguration() {
        return Optional.empty();
    }
}
