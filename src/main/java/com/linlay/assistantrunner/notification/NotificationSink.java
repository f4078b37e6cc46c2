package com.linlay.assistantrunner.notification;

import com.linlay.assistantrunner.model.EscalationRequest;
import com.linlay.assistantrunner.model.ExtractedContact;
import com.linlay.assistantrunner.model.TurnSideEffect;

public interface NotificationSink {

    void contactCaptured(ExtractedContact contact);

    void escalationRequested(EscalationRequest request);

    default void deliver(TurnSideEffect sideEffect) {
        if (sideEffect instanceof ExtractedContact contact) {
            contactCaptured(contact);
        } else if (sideEffect instanceof EscalationRequest request) {
            escalationRequested(request);
        }
    }
}
