package com.wom.openings.source.registry;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolved location of the trade-register API.
 *
 * @param baseUrl    scheme, host and base path, without trailing slash
 * @param searchPath path of the registration search, may be empty
 * @param detailPath path template with one {@code {placeholder}} for the business id
 */
public record EndpointDescriptor(String baseUrl, String searchPath, String detailPath) {

    static final Pattern PLACEHOLDER = Pattern.compile("\\{[^}/]+}");

    public EndpointDescriptor {
        baseUrl = stripTrailingSlash(baseUrl);
        searchPath = searchPath == null ? "" : searchPath;
        if (detailPath == null || !PLACEHOLDER.matcher(detailPath).find()) {
            detailPath = guessDetailPath(searchPath);
        }
    }

    public String searchUrl() {
        return baseUrl + searchPath;
    }

    public String detailUrl(String businessId) {
        String encoded = UriUtils.encodePathSegment(businessId, StandardCharsets.UTF_8);
        return baseUrl + PLACEHOLDER.matcher(detailPath).replaceFirst(Matcher.quoteReplacement(encoded));
    }

    /** Appends a placeholder segment to the search path. */
    static String guessDetailPath(String searchPath) {
        return stripTrailingSlash(searchPath == null ? "" : searchPath) + "/{businessId}";
    }

    static String stripTrailingSlash(String s) {
        if (s == null) return "";
        String out = s.strip();
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }
}
