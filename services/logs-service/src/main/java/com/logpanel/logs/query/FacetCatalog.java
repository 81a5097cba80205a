package com.logpanel.logs.query;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class FacetCatalog {
    public static final String CUSTOM_PREFIX = "@";
    public static final String LEVEL_ATTRIBUTE = "status";
    public static final String LEGACY_LEVEL_ATTRIBUTE = "level";

    public static final List<String> RESERVED_FACETS = List.of("host", "service", "source");
    public static final List<String> CUSTOM_FACETS = List.of(
        "env",
        "version",
        "container_name",
        "container_id",
        "image_name"
    );
    public static final Set<String> LEVELS = Set.of("debug", "info", "warn", "warning", "error", "fatal", "trace");
    public static final List<String> INLINE_TIME_FILTERS = List.of("@timestamp:", "timestamp:", "time:", "date:");

    private FacetCatalog() {
    }

    public static boolean isCustomAttribute(String facet) {
        return facet != null && CUSTOM_FACETS.contains(facet);
    }

    public static boolean isLevel(String value) {
        return value != null && LEVELS.contains(value.toLowerCase(Locale.ROOT));
    }
}
