package com.wom.openings.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wom.openings.service.DiscoveryResult;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DiscoveryResponse(
        String city,
        @JsonFormat(shape = JsonFormat.Shape.STRING) LocalDate cutoff,
        int total,
        Map<String, Integer> bySource,
        List<String> warnings,
        List<OpeningRow> rows
) {
    public static DiscoveryResponse from(DiscoveryResult result) {
        Map<String, Integer> bySource = new LinkedHashMap<>();
        result.keptBySource().forEach((source, n) -> bySource.put(source.displayName(), n));
        List<OpeningRow> rows = result.records().stream().map(OpeningRow::from).toList();
        return new DiscoveryResponse(
                result.context().city(),
                result.context().cutoff(),
                rows.size(),
                bySource,
                result.warnings(),
                rows
        );
    }
}
