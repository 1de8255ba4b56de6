package com.kge.k8s;

import com.kge.model.K8sEvent;
import java.util.List;

/**
 * Blocking access to the cluster resources kge needs. Every call may throw
 * {@link K8sConnectionException} or {@link K8sQueryException}.
 */
public interface K8sConnector {

    List<String> listPodNames(String namespace);

    /**
     * Names of replica sets carrying a {@code ReplicaFailure} condition.
     */
    List<String> listFailedReplicaSetNames(String namespace);

    /**
     * @param fieldSelector server-side selector such as {@code involvedObject.name=web,type!=Normal};
     *                      {@code null} or blank lists every event of the namespace
     */
    List<K8sEvent> listEvents(String namespace, String fieldSelector);

    List<String> listNamespaceNames();

    /**
     * Namespace of the active kube-context, {@code null} when the context does not set one.
     */
    String currentContextNamespace();
}
