package com.kge.config;

import com.kge.k8s.K8sConnectionException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds the fabric8 client from the ambient kube-config, or the in-cluster service account when running in a pod.
 */
@ApplicationScoped
public class KubernetesClientProducer {

    private static final Logger LOGGER = Logger.getLogger("KGE.KubernetesClient");

    @ConfigProperty(name = "kge.client.request-timeout-ms", defaultValue = "30000")
    int requestTimeoutMs;

    @ConfigProperty(name = "kge.client.connection-timeout-ms", defaultValue = "10000")
    int connectionTimeoutMs;

    private KubernetesClient client;

    @Produces
    @ApplicationScoped
    public KubernetesClient kubernetesClient() {
        try {
            Config config = new ConfigBuilder(Config.autoConfigure(null))
                    .withRequestTimeout(requestTimeoutMs)
                    .withConnectionTimeout(connectionTimeoutMs)
                    .build();
            client = new KubernetesClientBuilder().withConfig(config).build();
            LOGGER.debugv("[INIT] KubernetesClient ready. masterUrl={0} namespace={1}",
                    config.getMasterUrl(), config.getNamespace());
            return client;
        } catch (RuntimeException e) {
            LOGGER.errorf(e, "[INIT] Unable to configure the Kubernetes client");
            throw new K8sConnectionException("Error initializing Kubernetes client: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    void close() {
        if (client != null) {
            client.close();
        }
    }
}
