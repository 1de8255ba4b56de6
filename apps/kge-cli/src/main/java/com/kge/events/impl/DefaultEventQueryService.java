package com.kge.events.impl;

import com.kge.events.EventQueryService;
import com.kge.events.FieldSelector;
import com.kge.k8s.K8sConnector;
import com.kge.model.K8sEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Narrows event lists on the server with a field selector. Failures are not retried.
 */
@ApplicationScoped
public class DefaultEventQueryService implements EventQueryService {

    private static final Logger LOGGER = Logger.getLogger("KGE.EventQuery");

    private final K8sConnector k8s;

    @Inject
    public DefaultEventQueryService(K8sConnector k8s) {
        this.k8s = k8s;
    }

    @Override
    public List<K8sEvent> eventsForPod(String namespace, String podName, boolean nonNormalOnly) {
        if (podName == null || podName.isBlank()) {
            throw new IllegalArgumentException("pod name must not be blank");
        }
        return query(namespace, FieldSelector.forEvents(podName, nonNormalOnly));
    }

    @Override
    public List<K8sEvent> eventsForNamespace(String namespace, boolean nonNormalOnly) {
        return query(namespace, FieldSelector.forEvents(null, nonNormalOnly));
    }

    private List<K8sEvent> query(String namespace, FieldSelector selector) {
        String requestId = UUID.randomUUID().toString();
        Instant start = Instant.now();
        LOGGER.debugv("[COMM-START] requestId={0} target=KubernetesAPI action=list-events ns={1} fieldSelector={2}",
                requestId, namespace, selector);
        try {
            List<K8sEvent> events = k8s.listEvents(namespace, selector.render());
            LOGGER.debugv("[COMM-END] requestId={0} target=KubernetesAPI action=list-events events={1} durationMs={2}",
                    requestId, events.size(), Duration.between(start, Instant.now()).toMillis());
            return events;
        } catch (RuntimeException e) {
            LOGGER.debugf("[COMM-ERROR] requestId=%s target=KubernetesAPI action=list-events ns=%s detail=%s",
                    requestId, namespace, e.getMessage());
            throw e;
        }
    }
}
