package com.codingbridge.client.model;

/** Classification of errors surfaced to the session listener. */
public enum ErrorKind {
    /** Connection could not be established or was lost. */
    TRANSPORT,
    /** Server sent something the client could not interpret. */
    PROTOCOL,
    /** The agent reported a failure for the current command. */
    SERVER,
    /** No inbound activity for the configured processing timeout. */
    TIMEOUT,
    /** A queued command failed on every allowed attempt. */
    DELIVERY_EXHAUSTED,
    /** A command was submitted while no connection could be brought up. */
    NOT_CONNECTED
}
