package com.codingbridge.client.host;

/** A user-facing alert posted while the app is in the background. */
public record Notification(Kind kind, String title, String body) {

    public enum Kind {
        TASK_COMPLETE,
        APPROVAL_NEEDED,
        QUESTION_ASKED
    }
}
