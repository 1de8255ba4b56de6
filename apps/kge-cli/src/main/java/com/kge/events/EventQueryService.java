package com.kge.events;

import com.kge.model.K8sEvent;
import java.util.List;

public interface EventQueryService {

    List<K8sEvent> eventsForPod(String namespace, String podName, boolean nonNormalOnly);

    List<K8sEvent> eventsForNamespace(String namespace, boolean nonNormalOnly);
}
