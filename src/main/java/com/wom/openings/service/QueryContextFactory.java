package com.wom.openings.service;

import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.dto.DiscoveryRequest;
import com.wom.openings.exception.InvalidRequestException;
import com.wom.openings.model.QueryContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Fills request gaps from configured defaults and fixes "today" once for the run.
 */
@Service
public class QueryContextFactory {

    private final OpeningsProperties.Defaults defaults;
    private final Clock clock;

    @Autowired
    public QueryContextFactory(OpeningsProperties props) {
        this(props, Clock.systemDefaultZone());
    }

    public QueryContextFactory(OpeningsProperties props, Clock clock) {
        this.defaults = props.getDefaults();
        this.clock = clock;
    }

    /**
     * @throws InvalidRequestException when the request and defaults together do not form a usable context
     */
    public QueryContext create(DiscoveryRequest req) {
        try {
            return build(req);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    private QueryContext build(DiscoveryRequest req) {
        LocalDate today = LocalDate.now(clock);
        int months = req.months() != null ? req.months() : defaults.getMonths();
        return new QueryContext(
                req.city() != null && !req.city().isBlank() ? req.city() : defaults.getCity(),
                today,
                QueryContext.cutoff(today, months),
                req.amenities() != null && !req.amenities().isEmpty() ? req.amenities() : defaults.getAmenities(),
                req.registeredOffice(),
                req.businessLineCodes(),
                req.pageSize() != null ? req.pageSize() : defaults.getPageSize(),
                req.maxResults() != null ? req.maxResults() : defaults.getMaxResults(),
                flag(req.strictRestaurants(), false),
                flag(req.useNewerProxy(), defaults.isUseNewerProxy()),
                flag(req.reverseGeocode(), defaults.isReverseGeocode()),
                flag(req.placeSearch(), defaults.isPlaceSearch()),
                flag(req.registry(), defaults.isRegistry())
        );
    }

    private static boolean flag(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}
