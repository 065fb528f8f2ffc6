package com.wom.openings.service;

import com.wom.openings.model.CanonicalRecord;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.SourceLabel;

import java.util.List;
import java.util.Map;

public record DiscoveryResult(
        QueryContext context,
        List<CanonicalRecord> records,
        Map<SourceLabel, Integer> keptBySource,
        List<String> warnings
) {}
