package com.codingbridge.client.host;

/** Tells the core whether the user is currently looking at the app. */
@FunctionalInterface
public interface AppPresence {

    AppPresence ALWAYS_FOREGROUND = () -> true;

    boolean isForeground();
}
