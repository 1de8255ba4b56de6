package com.kge.format;

import java.time.Instant;

public record EventRow(
        String time,
        String type,
        String kind,
        String name,
        String reason,
        String message,
        int count,
        Instant firstSeen,
        Instant lastSeen
) {

    public boolean isNormal() {
        return "Normal".equals(type);
    }
}
