package net.spookly.httpgate.registry;

import java.util.Map;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors Devbox resources into the registry as {@code uniqueID -> namespace}.
 */
@Slf4j
final class DevboxEventHandler implements ResourceEventHandler<GenericKubernetesResource> {
    private final ServiceRegistry registry;
    private final String[] uniqueIdPath;

    DevboxEventHandler(ServiceRegistry registry, String uniqueIdPath) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.uniqueIdPath = Objects.requireNonNull(uniqueIdPath, "uniqueIdPath").split("\\.");
    }

    @Override
    public void onAdd(GenericKubernetesResource devbox) {
        apply(devbox);
    }

    @Override
    public void onUpdate(GenericKubernetesResource previous, GenericKubernetesResource devbox) {
        String previousId = uniqueId(previous);
        if (previousId != null && !previousId.equals(uniqueId(devbox))) {
            registry.unregister(previousId);
        }
        apply(devbox);
    }

    @Override
    public void onDelete(GenericKubernetesResource devbox, boolean deletedFinalStateUnknown) {
        String uniqueId = uniqueId(devbox);
        if (uniqueId != null && registry.unregister(uniqueId)) {
            log.info("Devbox unregistered uniqueId={} name={}", uniqueId, name(devbox));
        }
    }

    private void apply(GenericKubernetesResource devbox) {
        String uniqueId = uniqueId(devbox);
        if (uniqueId == null) {
            log.warn("Devbox {} has no {}, skipping", name(devbox), String.join(".", uniqueIdPath));
            return;
        }
        ObjectMeta metadata = devbox.getMetadata();
        String namespace = metadata == null ? null : metadata.getNamespace();
        if (namespace == null || namespace.isBlank()) {
            log.warn("Devbox {} has no namespace, skipping", name(devbox));
            return;
        }
        try {
            if (registry.register(uniqueId, namespace)) {
                log.info("Devbox registered uniqueId={} namespace={}", uniqueId, namespace);
            }
        } catch (IllegalArgumentException e) {
            log.warn("Devbox {} has an unusable uniqueId {}: {}", name(devbox), uniqueId, e.getMessage());
        }
    }

    String uniqueId(GenericKubernetesResource devbox) {
        if (devbox == null) {
            return null;
        }
        Object node = devbox.getAdditionalProperties();
        for (String segment : uniqueIdPath) {
            if (!(node instanceof Map)) {
                return null;
            }
            node = ((Map<?, ?>) node).get(segment);
        }
        if (!(node instanceof String) || ((String) node).isBlank()) {
            return null;
        }
        return ((String) node).trim();
    }

    private static String name(GenericKubernetesResource devbox) {
        ObjectMeta metadata = devbox.getMetadata();
        if (metadata == null) {
            return "<unnamed>";
        }
        return metadata.getNamespace() + "/" + metadata.getName();
    }
}
