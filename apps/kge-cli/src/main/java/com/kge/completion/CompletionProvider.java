package com.kge.completion;

import com.kge.k8s.K8sConnector;
import com.kge.namespace.NamespaceResolver;
import com.kge.resources.ResourceCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Space-separated word lists for shell completion. Never fails: a listing that cannot be produced completes to
 * nothing.
 */
@ApplicationScoped
public class CompletionProvider {

    private static final Logger LOGGER = Logger.getLogger("KGE.Completion");

    private final K8sConnector k8s;
    private final ResourceCatalog catalog;
    private final NamespaceResolver namespaces;

    @Inject
    public CompletionProvider(K8sConnector k8s, ResourceCatalog catalog, NamespaceResolver namespaces) {
        this.k8s = k8s;
        this.catalog = catalog;
        this.namespaces = namespaces;
    }

    public String namespaceWords() {
        try {
            return String.join(" ", k8s.listNamespaceNames());
        } catch (RuntimeException e) {
            LOGGER.debugv("Namespace completion unavailable: {0}", e.getMessage());
            return "";
        }
    }

    /**
     * Pods and failed replica sets of the namespace named by {@code -n/--namespace} in {@code rawArgs}, or of
     * the resolved namespace when the arguments carry none.
     */
    public String resourceWords(List<String> rawArgs) {
        String namespace = namespaceOverride(rawArgs)
                .orElseGet(() -> namespaces.ambient().namespace());
        try {
            return String.join(" ", catalog.completionResources(namespace));
        } catch (RuntimeException e) {
            LOGGER.debugv("Pod completion unavailable in namespace {0}: {1}", namespace, e.getMessage());
            return "";
        }
    }

    static Optional<String> namespaceOverride(List<String> rawArgs) {
        for (int i = 0; i < rawArgs.size(); i++) {
            String arg = rawArgs.get(i);
            if ((arg.equals("-n") || arg.equals("--namespace")) && i + 1 < rawArgs.size()) {
                return Optional.of(rawArgs.get(i + 1));
            }
            if (arg.startsWith("--namespace=") && arg.length() > "--namespace=".length()) {
                return Optional.of(arg.substring("--namespace=".length()));
            }
        }
        return Optional.empty();
    }
}
