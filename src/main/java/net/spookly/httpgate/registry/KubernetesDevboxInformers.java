package net.spookly.httpgate.registry;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

/**
 * Informers on the Devbox custom resource in every namespace. The client picks its configuration from
 * {@code KUBECONFIG}, the in-cluster service account, or {@code ~/.kube/config}, in that order of presence.
 */
public final class KubernetesDevboxInformers implements DevboxInformerLauncher, AutoCloseable {
    private final KubernetesClient client;
    private final ResourceDefinitionContext devboxes;

    public KubernetesDevboxInformers(KubernetesClient client, DevboxWatchSettings settings) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(settings, "settings");
        this.devboxes = new ResourceDefinitionContext.Builder()
                .withGroup(settings.group())
                .withVersion(settings.version())
                .withPlural(settings.plural())
                .withKind("Devbox")
                .withNamespaced(true)
                .build();
    }

    public static KubernetesDevboxInformers connect(DevboxWatchSettings settings) {
        return new KubernetesDevboxInformers(new KubernetesClientBuilder().build(), settings);
    }

    @Override
    public DevboxWatch launch(ResourceEventHandler<GenericKubernetesResource> handler) {
        SharedIndexInformer<GenericKubernetesResource> informer = client.genericKubernetesResources(devboxes)
                .inAnyNamespace()
                .runnableInformer(0L);
        informer.addEventHandler(handler);
        CompletionStage<Void> started = informer.start();
        return new DevboxWatch() {
            @Override
            public CompletionStage<Void> started() {
                return started;
            }

            @Override
            public CompletionStage<Void> stopped() {
                return informer.stopped();
            }

            @Override
            public void stop() {
                informer.close();
            }
        };
    }

    @Override
    public void close() {
        client.close();
    }
}
