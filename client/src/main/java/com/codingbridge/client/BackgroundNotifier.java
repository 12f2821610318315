package com.codingbridge.client;

import com.codingbridge.client.host.AppPresence;
import com.codingbridge.client.host.Notification;
import com.codingbridge.client.host.NotificationSink;
import com.codingbridge.client.model.ApprovalRequest;
import com.codingbridge.client.model.QuestionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts notifications only while the app is backgrounded. */
final class BackgroundNotifier {

    private static final Logger log = LoggerFactory.getLogger(BackgroundNotifier.class);
    private static final int MAX_BODY = 120;

    private final NotificationSink sink;
    private final AppPresence      presence;

    BackgroundNotifier(NotificationSink sink, AppPresence presence) {
        this.sink     = sink;
        this.presence = presence;
    }

    void taskComplete(String finalText) {
        String body = finalText == null || finalText.isBlank() ? "Claude has finished processing." : truncate(finalText);
        post(new Notification(Notification.Kind.TASK_COMPLETE, "Task Complete", body));
    }

    void approvalNeeded(ApprovalRequest request) {
        post(new Notification(Notification.Kind.APPROVAL_NEEDED, "Approval Needed",
                request.toolName() + ": " + request.description()));
    }

    void questionAsked(QuestionRequest question) {
        post(new Notification(Notification.Kind.QUESTION_ASKED, "Question from Claude",
                truncate(question.questions().get(0).question())));
    }

    private void post(Notification n) {
        if (presence.isForeground()) return;
        try {
            sink.post(n);
        } catch (RuntimeException e) {
            log.warn("Notification {} not delivered: {}", n.kind(), e.toString());
        }
    }

    private static String truncate(String s) {
        return s.length() > MAX_BODY ? s.substring(0, MAX_BODY) + "..." : s;
    }
}
