package com.codingbridge.client.transport;

import com.codingbridge.protocol.InboundFrame;

/**
 * Receives decoded frames and the failure of one connection.
 *
 * Called on transport threads; implementations hand work over to the session executor.
 * {@link #onFailure} is invoked at most once per connection and never after
 * {@link TransportConnection#close()}.
 */
public interface TransportListener {

    void onFrame(InboundFrame frame);

    void onFailure(Throwable cause);
}
