package com.kge.resources;

import com.kge.cache.TtlCache;
import com.kge.k8s.K8sConnector;
import com.kge.model.ResourceListing;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Pods and failed replica sets of a namespace, each listing cached on its own.
 * <p>
 * The two listings are fetched independently, so a combined view may mix two fetch instants.
 */
@ApplicationScoped
public class ResourceCatalog {

    private static final Logger LOGGER = Logger.getLogger("KGE.Resources");

    static final String PODS = "pods";
    static final String FAILED_REPLICA_SETS = "failed-replicasets";

    private final K8sConnector k8s;
    private final Clock clock;
    private final TtlCache<String, ResourceListing> pods;
    private final TtlCache<String, ResourceListing> failedReplicaSets;

    @Inject
    public ResourceCatalog(K8sConnector k8s, Clock clock,
            @ConfigProperty(name = "kge.cache.ttl-seconds", defaultValue = "10") long ttlSeconds) {
        this.k8s = k8s;
        this.clock = clock;
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        this.pods = new TtlCache<>(ttl, clock);
        this.failedReplicaSets = new TtlCache<>(ttl, clock);
    }

    /**
     * Pod names in fetch order. Failures propagate.
     */
    public ResourceListing pods(String namespace) {
        return pods.getOrFetch(namespace, () -> fetch(namespace, PODS, () -> k8s.listPodNames(namespace)));
    }

    /**
     * Names of replica sets reporting {@code ReplicaFailure}. A failed lookup is logged at WARN and yields an empty
     * listing that is not cached.
     */
    public ResourceListing failedReplicaSets(String namespace) {
        return failedReplicaSets(namespace, Logger.Level.WARN);
    }

    /**
     * Pods followed by failed replica sets, each in fetch order, without deduplication.
     */
    public List<String> selectableResources(String namespace) {
        return selectableResources(namespace, Logger.Level.WARN);
    }

    /**
     * Same listing as {@link #selectableResources(String)}, but a replica-set failure is only logged at DEBUG so
     * that nothing reaches the terminal while the shell completes a word.
     */
    public List<String> completionResources(String namespace) {
        return selectableResources(namespace, Logger.Level.DEBUG);
    }

    private List<String> selectableResources(String namespace, Logger.Level replicaSetFailureLevel) {
        List<String> resources = new ArrayList<>(pods(namespace).names());
        resources.addAll(failedReplicaSets(namespace, replicaSetFailureLevel).names());
        return List.copyOf(resources);
    }

    private ResourceListing failedReplicaSets(String namespace, Logger.Level failureLevel) {
        try {
            return failedReplicaSets.getOrFetch(namespace,
                    () -> fetch(namespace, FAILED_REPLICA_SETS, () -> k8s.listFailedReplicaSetNames(namespace)));
        } catch (RuntimeException e) {
            LOGGER.logv(failureLevel, "Error fetching ReplicaSets in namespace {0}: {1}", namespace, e.getMessage());
            return new ResourceListing(namespace, FAILED_REPLICA_SETS, List.of(), clock.instant());
        }
    }

    private ResourceListing fetch(String namespace, String kind, Supplier<List<String>> source) {
        long start = System.nanoTime();
        LOGGER.debugv("[COMM-START] target=KubernetesAPI action=list-{0} ns={1}", kind, namespace);
        List<String> names = source.get();
        LOGGER.debugv("[COMM-END] target=KubernetesAPI action=list-{0} ns={1} items={2} durationMs={3}",
                kind, namespace, names.size(), Duration.ofNanos(System.nanoTime() - start).toMillis());
        return new ResourceListing(namespace, kind, names, clock.instant());
    }
}
