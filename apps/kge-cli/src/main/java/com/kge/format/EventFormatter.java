package com.kge.format;

import com.kge.model.K8sEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Orders events by last-seen time, oldest first, with undated events last, and renders their timestamps.
 */
@ApplicationScoped
public class EventFormatter {

    public static final String NO_EVENTS = "No events found";
    static final String UNKNOWN_TIME = "unknown time";

    static final Comparator<K8sEvent> BY_LAST_SEEN =
            Comparator.comparing(K8sEvent::lastSeen, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Clock clock;

    @Inject
    public EventFormatter(Clock clock) {
        this.clock = clock;
    }

    public List<DisplayLine> format(List<K8sEvent> events, TimeStyle style) {
        if (events.isEmpty()) {
            return List.of(DisplayLine.notice(NO_EVENTS));
        }
        return rows(events, style).stream()
                .map(DisplayLine::of)
                .toList();
    }

    public List<EventRow> rows(List<K8sEvent> events, TimeStyle style) {
        Instant now = clock.instant();
        return events.stream()
                .sorted(BY_LAST_SEEN)
                .map(event -> new EventRow(
                        timestamp(event.lastSeen(), style, now),
                        event.type(),
                        event.involvedKind(),
                        event.involvedName(),
                        event.reason(),
                        event.message(),
                        event.count(),
                        event.firstSeen(),
                        event.lastSeen()))
                .toList();
    }

    static String timestamp(Instant lastSeen, TimeStyle style, Instant now) {
        if (lastSeen == null) {
            return UNKNOWN_TIME;
        }
        if (style == TimeStyle.ABSOLUTE) {
            return lastSeen.toString();
        }
        return relative(Duration.between(lastSeen, now));
    }

    /**
     * Largest whole unit among days, hours, minutes and seconds, rounded down. Future instants count as 0s.
     */
    static String relative(Duration elapsed) {
        long seconds = Math.max(0, elapsed.getSeconds());
        if (seconds >= 86_400) {
            return seconds / 86_400 + "d ago";
        }
        if (seconds >= 3_600) {
            return seconds / 3_600 + "h ago";
        }
        if (seconds >= 60) {
            return seconds / 60 + "m ago";
        }
        return seconds + "s ago";
    }
}
