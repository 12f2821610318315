package com.codingbridge.client.model;

/** Server notice that a session in some project was created, updated or deleted elsewhere. */
public record SessionsUpdate(String projectName, String sessionId, String action) {}
