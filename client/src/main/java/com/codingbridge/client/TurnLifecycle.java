package com.codingbridge.client;

/** Turn-level transitions shared by the stream, watchdog and interactive exchanges. */
interface TurnLifecycle {

    /** A turn reached a terminal event (complete, error, timeout); the queue may advance. */
    void turnEnded();

    /** Drops every piece of in-flight and queued work (abort). */
    void resetAll();
}
