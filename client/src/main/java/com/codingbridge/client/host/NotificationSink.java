package com.codingbridge.client.host;

/** Delivers background notifications (local push, tray message, console line...). */
@FunctionalInterface
public interface NotificationSink {

    NotificationSink NONE = n -> {};

    void post(Notification notification);
}
