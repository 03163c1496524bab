package io.ringsub.config.impl;

import io.ringsub.config.type.ConfigLoader;
import io.ringsub.exceptions.SubscriptionConfigException;
import io.ringsub.node.NodeCapabilities;
import lombok.Builder;
import lombok.ToString;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Optional;

/**
 * Static node capabilities, loaded from YAML:
 * <pre>
 * worker: false
 * inboxWorkQueueUri: amqp://broker/orders-inbox
 * </pre>
 * A node has an inbox exactly when {@code inboxWorkQueueUri} is set.
 */
@Builder
@ToString
public final class NodeConfig implements NodeCapabilities {

    private final boolean worker;
    private final URI inboxWorkQueueUri;

    public static NodeConfig load(final String path) throws IOException {
        return fromMap(ConfigLoader.readYaml(path));
    }

    public static NodeConfig fromMap(final Map<String, Object> m) {
        final Object rawUri = m.get("inboxWorkQueueUri");
        URI uri = null;
        if (rawUri != null && !rawUri.toString().isBlank()) {
            try {
                uri = new URI(rawUri.toString().strip());
            } catch (final URISyntaxException e) {
                throw new SubscriptionConfigException("Invalid inboxWorkQueueUri '" + rawUri + "'", e);
            }
        }

        return NodeConfig.builder()
                .worker(Boolean.TRUE.equals(m.get("worker")))
                .inboxWorkQueueUri(uri)
                .build();
    }

    @Override
    public boolean isWorker() {
        return worker;
    }

    @Override
    public boolean hasInbox() {
        return inboxWorkQueueUri != null;
    }

    @Override
    public Optional<URI> getInboxWorkQueueUri() {
        return Optional.ofNullable(inboxWorkQueueUri);
    }
}
