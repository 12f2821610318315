package com.codingbridge.client.model;

import java.util.Objects;

public record SessionError(ErrorKind kind, String message) {

    public SessionError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
