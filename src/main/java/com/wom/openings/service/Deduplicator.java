package com.wom.openings.service;

import com.wom.openings.model.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * First-seen-wins merge on {@link CanonicalRecord#dedupKey()}.
 *
 * <p>A later record with a known key is dropped even if it is more complete than the one kept.
 * Records with an empty key (no name and no address) are always kept.
 */
@Slf4j
@Service
public class Deduplicator {

    /** @return true if the record survived and was appended to the context */
    public boolean offer(DeduplicationContext context, CanonicalRecord record) {
        String key = record.dedupKey();
        if (!key.isEmpty() && !context.markSeen(key)) {
            log.debug("[Openings] duplicate dropped key=\"{}\" source={}", key, record.source());
            return false;
        }
        context.keep(record);
        return true;
    }

    /** Offers every record in order and returns the ones that survived. */
    public List<CanonicalRecord> fold(DeduplicationContext context, Iterable<CanonicalRecord> records) {
        List<CanonicalRecord> kept = new ArrayList<>();
        for (CanonicalRecord r : records) {
            if (offer(context, r)) kept.add(r);
        }
        return kept;
    }
}
