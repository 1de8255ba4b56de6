package com.kge.cli;

import com.kge.events.EventFilter;
import com.kge.format.TimeStyle;
import java.util.Optional;

public record Invocation(
        Optional<String> pod,
        boolean all,
        boolean exceptionsOnly,
        Optional<String> namespace,
        EventFilter filter,
        TimeStyle timeStyle,
        OutputFormat output
) {

    public static Invocation interactive() {
        return new Invocation(Optional.empty(), false, false, Optional.empty(), EventFilter.NONE,
                TimeStyle.RELATIVE, OutputFormat.TEXT);
    }

    public Invocation withPod(String name) {
        return new Invocation(Optional.of(name), all, exceptionsOnly, namespace, filter, timeStyle, output);
    }

    public Invocation withAll() {
        return new Invocation(pod, true, exceptionsOnly, namespace, filter, timeStyle, output);
    }

    public Invocation withExceptionsOnly() {
        return new Invocation(pod, all, true, namespace, filter, timeStyle, output);
    }

    public Invocation withNamespace(String name) {
        return new Invocation(pod, all, exceptionsOnly, Optional.of(name), filter, timeStyle, output);
    }

    public Invocation withFilter(EventFilter eventFilter) {
        return new Invocation(pod, all, exceptionsOnly, namespace, eventFilter, timeStyle, output);
    }

    public Invocation withTimeStyle(TimeStyle style) {
        return new Invocation(pod, all, exceptionsOnly, namespace, filter, style, output);
    }

    public Invocation withOutput(OutputFormat format) {
        return new Invocation(pod, all, exceptionsOnly, namespace, filter, timeStyle, format);
    }
}
