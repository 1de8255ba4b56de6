package com.kge.events;

import com.kge.model.K8sEvent;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record EventFilter(Optional<String> reason, Optional<String> kind, Optional<String> type) {

    public static final EventFilter NONE = new EventFilter(Optional.empty(), Optional.empty(), Optional.empty());

    public EventFilter {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
    }

    public boolean isEmpty() {
        return reason.isEmpty() && kind.isEmpty() && type.isEmpty();
    }

    public boolean matches(K8sEvent event) {
        return reason.map(value -> value.equals(event.reason())).orElse(true)
                && kind.map(value -> value.equals(event.involvedKind())).orElse(true)
                && type.map(value -> value.equals(event.type())).orElse(true);
    }

    public List<K8sEvent> apply(List<K8sEvent> events) {
        if (isEmpty()) {
            return events;
        }
        return events.stream().filter(this::matches).toList();
    }
}
