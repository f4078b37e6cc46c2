package com.linlay.assistantrunner.support;

import com.linlay.assistantrunner.model.EscalationRequest;
import com.linlay.assistantrunner.model.ExtractedContact;
import com.linlay.assistantrunner.notification.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationSink implements NotificationSink {

    private final List<ExtractedContact> contacts = new CopyOnWriteArrayList<>();
    private final List<EscalationRequest> escalations = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingNotificationSink failing() {
        this.failing = true;
        return this;
    }

    @Override
    public void contactCaptured(ExtractedContact contact) {
        contacts.add(contact);
        if (failing) {
            throw new IllegalStateException("sink down");
        }
    }

    @Override
    public void escalationRequested(EscalationRequest request) {
        escalations.add(request);
        if (failing) {
            throw new IllegalStateException("sink down");
        }
    }

    public List<ExtractedContact> contacts() {
        return List.copyOf(contacts);
    }

    public List<EscalationRequest> escalations() {
        return List.copyOf(escalations);
    }
}
