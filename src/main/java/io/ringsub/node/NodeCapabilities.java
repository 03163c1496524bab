package io.ringsub.node;

import java.net.URI;
import java.util.Optional;

/**
 * What the local node can do on the bus.
 */
public interface NodeCapabilities {

    /**
     * A worker processes messages distributed to it but never receives published messages,
     * so it has nothing to subscribe.
     */
    boolean isWorker();

    boolean hasInbox();

    /**
     * The inbox work queue published messages are delivered to, if this node has one.
     */
    Optional<URI> getInboxWorkQueueUri();
}
