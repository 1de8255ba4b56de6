package com.kge.namespace;

public record NamespaceContext(String namespace, Source source) {

    public enum Source {
        EXPLICIT,
        KUBE_CONTEXT,
        FALLBACK
    }
}
