package com.kge.k8s.impl;

import com.kge.k8s.K8sConnectionException;
import com.kge.k8s.K8sQueryException;
import com.kge.model.K8sEvent;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.EventListBuilder;
import io.fabric8.kubernetes.api.model.MicroTime;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.NamespaceListBuilder;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodListBuilder;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetBuilder;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetListBuilder;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableKubernetesMockClient
class DefaultK8sConnectorTest {

    KubernetesMockServer server;
    KubernetesClient client;

    DefaultK8sConnector connector;

    @BeforeEach
    void setUp() {
        connector = new DefaultK8sConnector(client);
    }

    @Test
    void listsPodNamesInOrder() {
        server.expect().get().withPath("/api/v1/namespaces/default/pods")
                .andReturn(200, new PodListBuilder()
                        .addToItems(new PodBuilder().withNewMetadata().withName("web-2").endMetadata().build())
                        .addToItems(new PodBuilder().withNewMetadata().withName("web-1").endMetadata().build())
                        .build())
                .once();

        assertEquals(List.of("web-2", "web-1"), connector.listPodNames("default"));
    }

    @Test
    void keepsOnlyReplicaSetsWithReplicaFailure() {
        server.expect().get().withPath("/apis/apps/v1/namespaces/default/replicasets")
                .andReturn(200, new ReplicaSetListBuilder()
                        .addToItems(replicaSet("api-7c9d", "ReplicaFailure"))
                        .addToItems(replicaSet("api-5f6b", "Available"))
                        .addToItems(new ReplicaSetBuilder().withNewMetadata().withName("bare").endMetadata().build())
                        .build())
                .once();

        assertEquals(List.of("api-7c9d"), connector.listFailedReplicaSetNames("default"));
    }

    @Test
    void replicaSetWithoutStatusIsHealthy() {
        assertFalse(DefaultK8sConnector.hasReplicaFailure(new ReplicaSet()));
        assertTrue(DefaultK8sConnector.hasReplicaFailure(replicaSet("x", "ReplicaFailure")));
    }

    @Test
    void mapsEventFields() {
        server.expect().get().withPath("/api/v1/namespaces/default/events")
                .andReturn(200, new EventListBuilder()
                        .addToItems(new EventBuilder()
                                .withNewMetadata().withName("web-1.1").withNamespace("default").endMetadata()
                                .withNewInvolvedObject().withKind("Pod").withName("web-1").endInvolvedObject()
                                .withReason("BackOff")
                                .withMessage("Back-off restarting failed container")
                                .withType("Warning")
                                .withCount(4)
                                .withFirstTimestamp("2024-01-01T10:00:00Z")
                                .withLastTimestamp("2024-01-01T11:58:00Z")
                                .build())
                        .addToItems(new EventBuilder()
                                .withNewMetadata().withName("web-1.2").withNamespace("default").endMetadata()
                                .withNewInvolvedObject().withKind("Pod").withName("web-1").endInvolvedObject()
                                .withReason("Scheduled")
                                .withType("Normal")
                                .withEventTime(new MicroTime("2024-01-01T11:00:00.000000Z"))
                                .build())
                        .build())
                .once();

        List<K8sEvent> events = connector.listEvents("default", null);

        assertEquals(2, events.size());
        K8sEvent backOff = events.get(0);
        assertEquals("web-1", backOff.involvedName());
        assertEquals("Pod", backOff.involvedKind());
        assertEquals(4, backOff.count());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), backOff.firstSeen());
        assertEquals(Instant.parse("2024-01-01T11:58:00Z"), backOff.lastSeen());
        assertFalse(backOff.isNormal());

        K8sEvent scheduled = events.get(1);
        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), scheduled.lastSeen());
        assertNull(scheduled.firstSeen());
        assertEquals(1, scheduled.count());
        assertTrue(scheduled.isNormal());
    }

    @Test
    void listsNamespaces() {
        server.expect().get().withPath("/api/v1/namespaces")
                .andReturn(200, new NamespaceListBuilder()
                        .addToItems(new NamespaceBuilder().withNewMetadata().withName("default").endMetadata().build())
                        .addToItems(new NamespaceBuilder().withNewMetadata().withName("kube-system").endMetadata().build())
                        .build())
                .once();

        assertEquals(List.of("default", "kube-system"), connector.listNamespaceNames());
    }

    @Test
    void rejectedRequestCarriesHttpStatus() {
        server.expect().get().withPath("/api/v1/namespaces/locked/pods")
                .andReturn(403, new StatusBuilder().withCode(403).withMessage("pods is forbidden").build())
                .once();

        K8sQueryException e = assertThrows(K8sQueryException.class, () -> connector.listPodNames("locked"));

        assertEquals(403, e.status());
        assertTrue(e.getMessage().contains("HTTP 403"));
        assertTrue(e.getMessage().contains("locked"));
    }

    @Test
    void unreachableApiServerIsAConnectionFailure() {
        try (KubernetesClient unreachable = new KubernetesClientBuilder()
                .withConfig(new ConfigBuilder()
                        .withMasterUrl("https://127.0.0.1:1")
                        .withRequestRetryBackoffLimit(0)
                        .withConnectionTimeout(1000)
                        .withRequestTimeout(1000)
                        .build())
                .build()) {
            DefaultK8sConnector offline = new DefaultK8sConnector(unreachable);

            K8sConnectionException e = assertThrows(K8sConnectionException.class,
                    () -> offline.listPodNames("default"));

            assertTrue(e.getMessage().startsWith("Unable to reach the Kubernetes API to list pods in namespace default"));
        }
    }

    @Test
    void contextNamespaceComesFromClientConfiguration() {
        assertEquals(client.getConfiguration().getNamespace(), connector.currentContextNamespace());
    }

    private static ReplicaSet replicaSet(String name, String conditionType) {
        return new ReplicaSetBuilder()
                .withNewMetadata().withName(name).endMetadata()
                .withNewStatus()
                .addNewCondition().withType(conditionType).withStatus("True").endCondition()
                .endStatus()
                .build();
    }
}
