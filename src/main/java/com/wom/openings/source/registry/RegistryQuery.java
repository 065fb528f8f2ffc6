package com.wom.openings.source.registry;

import com.wom.openings.model.QueryContext;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;

/**
 * One registration search: date range, registered office, optional business-line code and a page window.
 */
public record RegistryQuery(
        LocalDate registeredFrom,
        LocalDate registeredTo,
        String registeredOffice,
        String businessLineCode,
        int offset,
        int size
) {

    /** Smallest query that still exercises the date-range filter: one result, first page. */
    public static RegistryQuery probe(QueryContext ctx) {
        String code = ctx.businessLineCodes().isEmpty() ? null : ctx.businessLineCodes().get(0);
        return new RegistryQuery(ctx.cutoff(), ctx.today(), ctx.registeredOffice(), code, 0, 1);
    }

    public static RegistryQuery page(QueryContext ctx, String businessLineCode, int offset) {
        return new RegistryQuery(ctx.cutoff(), ctx.today(), ctx.registeredOffice(), businessLineCode, offset, ctx.pageSize());
    }

    /**
     * @param dateParams names of the from/to registration-date parameters, in that order
     */
    public URI toUri(String searchUrl, List<String> dateParams) {
        UriComponentsBuilder b = UriComponentsBuilder.fromUriString(searchUrl)
                .queryParam("totalResults", false)
                .queryParam("maxResults", size)
                .queryParam("resultsFrom", offset)
                .queryParam("registeredOffice", registeredOffice)
                .queryParam(dateParams.get(0), registeredFrom)
                .queryParam(dateParams.get(1), registeredTo);
        if (businessLineCode != null && !businessLineCode.isBlank()) {
            b.queryParam("businessLineCode", businessLineCode);
        }
        return b.encode().build().toUri();
    }
}
