package net.spookly.httpgate.registry;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;

/**
 * Starts a watch that feeds every Devbox add, update and delete to {@code handler}.
 */
@FunctionalInterface
public interface DevboxInformerLauncher {
    DevboxWatch launch(ResourceEventHandler<GenericKubernetesResource> handler);
}
