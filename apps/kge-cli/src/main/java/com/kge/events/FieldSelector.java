package com.kge.events;

import java.util.ArrayList;
import java.util.List;

public final class FieldSelector {

    private final List<String> predicates = new ArrayList<>();

    private FieldSelector() {
    }

    private static FieldSelector create() {
        return new FieldSelector();
    }

    public static FieldSelector forEvents(String involvedObjectName, boolean nonNormalOnly) {
        FieldSelector selector = create();
        if (involvedObjectName != null) {
            selector.equalTo("involvedObject.name", involvedObjectName);
        }
        if (nonNormalOnly) {
            selector.notEqualTo("type", "Normal");
        }
        return selector;
    }

    public FieldSelector equalTo(String field, String value) {
        predicates.add(field + "=" + value);
        return this;
    }

    public FieldSelector notEqualTo(String field, String value) {
        predicates.add(field + "!=" + value);
        return this;
    }

    // null when there is nothing to filter on
    public String render() {
        return predicates.isEmpty() ? null : String.join(",", predicates);
    }

    @Override
    public String toString() {
        return predicates.isEmpty() ? "<none>" : String.join(",", predicates);
    }
}
