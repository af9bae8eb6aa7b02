package com.customdim.service.core.extraction;

import java.util.Map;

/**
 * Attributes of a tracked hit that extraction sources can read.
 *
 * @param url page URL including the query string
 * @param actionName page title / action name
 * @param explicitValues values sent explicitly by the client, keyed {@code dimension<id>}
 */
public record TrackingRequest(String url, String actionName, Map<String, String> explicitValues) {
    public TrackingRequest {
        explicitValues = explicitValues == null ? Map.of() : Map.copyOf(explicitValues);
    }

    public static TrackingRequest of(String url, String actionName) {
        return new TrackingRequest(url, actionName, Map.of());
    }
}
