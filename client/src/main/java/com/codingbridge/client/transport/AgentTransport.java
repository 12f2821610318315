package com.codingbridge.client.transport;

import java.net.URI;

/**
 * Opens bidirectional text-frame connections to the agent server.
 *
 * Implementations never throw from {@link #open}; connection failures are
 * reported through {@link TransportListener#onFailure}.
 */
public interface AgentTransport {

    TransportConnection open(URI endpoint, TransportListener listener);
}
