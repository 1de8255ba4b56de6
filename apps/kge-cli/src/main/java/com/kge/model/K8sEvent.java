package com.kge.model;

import java.time.Instant;

public record K8sEvent(
        String namespace,
        String involvedName,
        String involvedKind,
        String reason,
        String message,
        Instant firstSeen,
        Instant lastSeen,
        String type,
        int count
) {

    public static final String NORMAL = "Normal";

    public boolean isNormal() {
        return NORMAL.equals(type);
    }
}
