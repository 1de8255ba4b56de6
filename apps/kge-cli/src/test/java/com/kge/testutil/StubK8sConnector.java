package com.kge.testutil;

import com.kge.k8s.K8sConnector;
import com.kge.model.K8sEvent;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory cluster that records every call made against it.
 */
public class StubK8sConnector implements K8sConnector {

    public Supplier<List<String>> pods = List::of;
    public Supplier<List<String>> failedReplicaSets = List::of;
    public Supplier<List<K8sEvent>> events = List::of;
    public Supplier<List<String>> namespaces = List::of;
    public String contextNamespace;

    public final List<String> podCalls = new ArrayList<>();
    public final List<String> replicaSetCalls = new ArrayList<>();
    public final List<Map.Entry<String, String>> eventCalls = new ArrayList<>();

    @Override
    public List<String> listPodNames(String namespace) {
        podCalls.add(namespace);
        return pods.get();
    }

    @Override
    public List<String> listFailedReplicaSetNames(String namespace) {
        replicaSetCalls.add(namespace);
        return failedReplicaSets.get();
    }

    @Override
    public List<K8sEvent> listEvents(String namespace, String fieldSelector) {
        eventCalls.add(new AbstractMap.SimpleEntry<>(namespace, fieldSelector));
        return events.get();
    }

    @Override
    public List<String> listNamespaceNames() {
        return namespaces.get();
    }

    @Override
    public String currentContextNamespace() {
        return contextNamespace;
    }
}
