package com.kge.k8s.impl;

import com.kge.k8s.K8sConnectionException;
import com.kge.k8s.K8sConnector;
import com.kge.k8s.K8sQueryException;
import com.kge.model.K8sEvent;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventList;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.MicroTime;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetCondition;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class DefaultK8sConnector implements K8sConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultK8sConnector.class);

    static final String REPLICA_FAILURE = "ReplicaFailure";

    private final KubernetesClient client;

    @Inject
    public DefaultK8sConnector(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public List<String> listPodNames(String namespace) {
        return names(call("list pods", namespace,
                () -> client.pods().inNamespace(namespace).list()));
    }

    @Override
    public List<String> listFailedReplicaSetNames(String namespace) {
        var replicaSets = call("list replica sets", namespace,
                () -> client.apps().replicaSets().inNamespace(namespace).list());
        return items(replicaSets).stream()
                .filter(DefaultK8sConnector::hasReplicaFailure)
                .map(rs -> rs.getMetadata().getName())
                .toList();
    }

    @Override
    public List<K8sEvent> listEvents(String namespace, String fieldSelector) {
        var events = client.v1().events().inNamespace(namespace);
        EventList eventList = call("list events", namespace, () -> fieldSelector == null || fieldSelector.isBlank()
                ? events.list()
                : events.list(new ListOptionsBuilder().withFieldSelector(fieldSelector).build()));
        return items(eventList).stream()
                .map(event -> toEvent(namespace, event))
                .toList();
    }

    @Override
    public List<String> listNamespaceNames() {
        return names(call("list namespaces", null, () -> client.namespaces().list()));
    }

    @Override
    public String currentContextNamespace() {
        return Optional.ofNullable(client.getConfiguration())
                .map(config -> config.getNamespace())
                .orElse(null);
    }

    static boolean hasReplicaFailure(ReplicaSet replicaSet) {
        if (replicaSet.getStatus() == null || replicaSet.getStatus().getConditions() == null) {
            return false;
        }
        return replicaSet.getStatus().getConditions().stream()
                .map(ReplicaSetCondition::getType)
                .anyMatch(REPLICA_FAILURE::equals);
    }

    private <L> L call(String action, String namespace, Supplier<L> request) {
        try {
            return request.get();
        } catch (KubernetesClientException e) {
            LOGGER.debug("Failed to {} in namespace {}: code={} message={}", action, namespace, e.getCode(), e.getMessage());
            String scope = namespace == null ? "" : " in namespace " + namespace;
            // fabric8 leaves the code unset when no HTTP response was received
            if (e.getCode() <= 0) {
                throw new K8sConnectionException("Unable to reach the Kubernetes API to " + action + scope
                        + ": " + e.getMessage(), e);
            }
            throw new K8sQueryException("Failed to " + action + scope + " (HTTP " + e.getCode() + "): "
                    + Optional.ofNullable(e.getStatus()).map(status -> status.getMessage()).orElse(e.getMessage()),
                    e.getCode(), e);
        }
    }

    private static <T extends HasMetadata> List<T> items(KubernetesResourceList<T> list) {
        return Optional.ofNullable(list)
                .map(KubernetesResourceList::getItems)
                .orElse(List.of());
    }

    private static <T extends HasMetadata> List<String> names(KubernetesResourceList<T> list) {
        return items(list).stream()
                .map(item -> item.getMetadata().getName())
                .filter(Objects::nonNull)
                .toList();
    }

    private K8sEvent toEvent(String namespace, Event event) {
        ObjectReference involved = event.getInvolvedObject();
        String eventNamespace = Optional.ofNullable(event.getMetadata())
                .map(meta -> meta.getNamespace())
                .orElse(namespace);
        Instant lastSeen = parseInstant(event.getLastTimestamp())
                .or(() -> fromMicroTime(event.getEventTime()))
                .orElse(null);
        return new K8sEvent(
                eventNamespace,
                involved != null ? involved.getName() : null,
                involved != null ? involved.getKind() : null,
                event.getReason(),
                event.getMessage(),
                parseInstant(event.getFirstTimestamp()).orElse(null),
                lastSeen,
                event.getType(),
                Optional.ofNullable(event.getCount()).orElse(1));
    }

    private Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (Exception ex) {
            LOGGER.debug("Unable to parse timestamp {}: {}", value, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Instant> fromMicroTime(MicroTime microTime) {
        if (microTime == null) {
            return Optional.empty();
        }
        return parseInstant(microTime.getTime());
    }
}
