package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.client.RemoteAssistantClient;
import com.linlay.assistantrunner.notification.NotificationSink;
import com.linlay.assistantrunner.run.RemoteCallExecutor;
import com.linlay.assistantrunner.run.RunPoller;

public record SessionDependencies(
        RemoteAssistantClient client,
        RunPoller runPoller,
        RemoteCallExecutor callExecutor,
        ThreadDirectory threadDirectory,
        NotificationSink notificationSink,
        ReplyFormatter replyFormatter,
        TurnHistory turnHistory
) {
}
