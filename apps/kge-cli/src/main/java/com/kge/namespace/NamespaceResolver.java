package com.kge.namespace;

import com.kge.k8s.K8sConnector;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Resolves the active namespace. An explicit value always wins and is not checked against the cluster.
 * Otherwise the kube-context namespace is looked up once and reused for the lifetime of this resolver, even if
 * the context changes meanwhile.
 */
@ApplicationScoped
public class NamespaceResolver {

    private static final Logger LOGGER = Logger.getLogger("KGE.Namespace");

    private final Supplier<String> contextNamespace;
    private final String fallback;

    private NamespaceContext ambient;

    @Inject
    public NamespaceResolver(K8sConnector connector,
            @ConfigProperty(name = "kge.namespace.fallback", defaultValue = "default") String fallback) {
        this(connector::currentContextNamespace, fallback);
    }

    public NamespaceResolver(Supplier<String> contextNamespace, String fallback) {
        this.contextNamespace = contextNamespace;
        this.fallback = fallback;
    }

    public NamespaceContext resolve(Optional<String> explicitNamespace) {
        if (explicitNamespace.isPresent()) {
            return new NamespaceContext(explicitNamespace.get(), NamespaceContext.Source.EXPLICIT);
        }
        return ambient();
    }

    public synchronized NamespaceContext ambient() {
        if (ambient == null) {
            ambient = lookupContext();
        }
        return ambient;
    }

    private NamespaceContext lookupContext() {
        try {
            String namespace = contextNamespace.get();
            if (namespace != null && !namespace.isBlank()) {
                LOGGER.debugv("Using namespace {0} from the kube-context", namespace);
                return new NamespaceContext(namespace, NamespaceContext.Source.KUBE_CONTEXT);
            }
        } catch (RuntimeException e) {
            LOGGER.debugv("Unable to read the kube-context namespace: {0}", e.getMessage());
        }
        return new NamespaceContext(fallback, NamespaceContext.Source.FALLBACK);
    }
}
