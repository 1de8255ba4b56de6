package com.kge.model;

import java.time.Instant;
import java.util.List;

public record ResourceListing(
        String namespace,
        String kind,
        List<String> names,
        Instant fetchedAt
) {

    public ResourceListing {
        names = List.copyOf(names);
    }
}
