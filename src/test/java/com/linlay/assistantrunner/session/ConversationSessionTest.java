package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.client.CallResult;
import com.linlay.assistantrunner.model.AssistantReply;
import com.linlay.assistantrunner.model.TurnError;
import com.linlay.assistantrunner.model.TurnErrorCategory;
import com.linlay.assistantrunner.model.TurnResult;
import com.linlay.assistantrunner.run.RunStatus;
import com.linlay.assistantrunner.run.ToolCallRequest;
import com.linlay.assistantrunner.support.FakeAssistantClient;
import com.linlay.assistantrunner.support.RecordingNotificationSink;
import com.linlay.assistantrunner.support.TestSessions;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationSessionTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final FakeAssistantClient client = new FakeAssistantClient();
    private final InMemoryThreadDirectory threadDirectory = new InMemoryThreadDirectory();
    private final RecordingNotificationSink sink = new RecordingNotificationSink();

    @Test
    void firstTurnShouldCreateThreadAndReturnReply() {
        client.reply("thread-1", "Hi! How can I help?");
        ConversationSession session = session("u1", sink);

        TurnResult result = session.handleTurn("hello").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(AssistantReply.class, reply -> {
            assertThat(reply.text()).isEqualTo("Hi! How can I help?");
            assertThat(reply.threadId()).isEqualTo("thread-1");
            assertThat(reply.runId()).isEqualTo("run-1");
            assertThat(reply.turnSequence()).isEqualTo(1);
            assertThat(reply.contacts()).isEmpty();
        });
        assertThat(client.calls()).containsExactly(
                "createThread:thread-1",
                "postMessage:thread-1:hello",
                "createRun:thread-1:run-1",
                "getRunStatus:run-1",
                "getLatestMessage:thread-1"
        );
        assertThat(threadDirectory.find("u1")).contains("thread-1");
        assertThat(session.activeRun()).isEmpty();
        assertThat(session.isTurnInFlight()).isFalse();
    }

    @Test
    void laterTurnsShouldReuseThread() {
        ConversationSession session = session("u1", sink);

        session.handleTurn("one").block(WAIT);
        TurnResult second = session.handleTurn("two").block(WAIT);

        assertThat(client.count("createThread")).isEqualTo(1);
        assertThat(second).isInstanceOfSatisfying(AssistantReply.class, reply -> {
            assertThat(reply.turnSequence()).isEqualTo(2);
            assertThat(reply.threadId()).isEqualTo("thread-1");
        });
    }

    @Test
    void emptyThreadShouldAnswerWithFallbackText() {
        TurnResult result = session("u1", sink).handleTurn("hello").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(AssistantReply.class,
                reply -> assertThat(reply.text()).isEqualTo("Sorry, no answer could be produced. Please try again."));
    }

    @Test
    void concurrentTurnShouldBeRejectedAsBusy() throws Exception {
        threadDirectory.record("u1", "t1");
        client.enqueueStatus("t1", RunStatus.IN_PROGRESS).statusDelay("t1", Duration.ofMillis(100));
        ConversationSession session = session("u1", sink);

        CompletableFuture<TurnResult> first = session.handleTurn("first").toFuture();
        TurnResult second = session.handleTurn("second").block(WAIT);

        assertThat(second).isInstanceOfSatisfying(TurnError.class, error -> {
            assertThat(error.category()).isEqualTo(TurnErrorCategory.BUSY);
            assertThat(error.turnSequence()).isZero();
        });
        assertThat(first.get(5, TimeUnit.SECONDS)).isInstanceOf(AssistantReply.class);
        assertThat(client.count("postMessage")).isEqualTo(1);
        assertThat(session.isTurnInFlight()).isFalse();
    }

    @Test
    void contactCaptureShouldNotifySinkExactlyOnce() {
        threadDirectory.record("u1", "t1");
        client.enqueueToolCalls("t1", new ToolCallRequest("call_1", "get_client_contact_info",
                        Map.of("name", "Ann", "phone_number", "+1 555 0100")))
                .reply("t1", "Thank you, Ann!");

        TurnResult result = session("u1", sink).handleTurn("my phone is +1 555 0100").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(AssistantReply.class, reply -> {
            assertThat(reply.text()).isEqualTo("Thank you, Ann!");
            assertThat(reply.contacts()).singleElement()
                    .satisfies(contact -> assertThat(contact.phone()).isEqualTo("+15550100"));
        });
        assertThat(sink.contacts()).hasSize(1);
        assertThat(client.count("submitToolOutputs")).isEqualTo(1);
    }

    @Test
    void sinkFailureShouldNotFailTurn() {
        threadDirectory.record("u1", "t1");
        client.enqueueToolCalls("t1", new ToolCallRequest("call_1", "request_manager_callback", Map.of("reason", "refund")))
                .reply("t1", "A manager will contact you");
        RecordingNotificationSink failingSink = new RecordingNotificationSink().failing();

        TurnResult result = session("u1", failingSink).handleTurn("I want a manager").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(AssistantReply.class,
                reply -> assertThat(reply.escalations()).hasSize(1));
        assertThat(failingSink.escalations()).hasSize(1);
    }

    @Test
    void cancelledTurnShouldLeaveOrphanThatNextTurnCancels() throws Exception {
        threadDirectory.record("u1", "t1");
        client.defaultStatus("t1", RunStatus.IN_PROGRESS);
        ConversationSession session = session("u1", sink);

        Disposable abandoned = session.handleTurn("first").subscribe();
        awaitCondition(() -> session.activeRun().isPresent());
        abandoned.dispose();

        assertThat(session.isTurnInFlight()).isFalse();
        assertThat(session.orphanedRun()).hasValueSatisfying(run -> assertThat(run.runId()).isEqualTo("run-1"));
        assertThat(session.isIdle()).isFalse();

        client.defaultStatus("t1", RunStatus.COMPLETED).enqueueStatus("t1", RunStatus.IN_PROGRESS).reply("t1", "done");
        TurnResult result = session.handleTurn("second").block(WAIT);

        assertThat(result).isInstanceOf(AssistantReply.class);
        List<String> calls = client.calls();
        assertThat(calls.indexOf("cancelRun:run-1")).isLessThan(calls.indexOf("postMessage:t1:second"));
        assertThat(calls).contains("createRun:t1:run-2");
        assertThat(session.orphanedRun()).isEmpty();
    }

    @Test
    void runCreatedWhileTurnWasCancelledShouldBeSettledBeforeNextMessage() throws Exception {
        threadDirectory.record("u1", "t1");
        client.createRunDelay("t1", Duration.ofMillis(300));
        ConversationSession session = session("u1", sink);

        Disposable abandoned = session.handleTurn("one").subscribe();
        awaitCondition(() -> client.count("createRun:t1") == 1);
        abandoned.dispose();

        assertThat(session.isTurnInFlight()).isFalse();
        assertThat(session.orphanedRun()).isEmpty();
        assertThat(session.isRunStateUnknown()).isTrue();
        assertThat(session.isIdle()).isFalse();

        client.enqueueStatus("t1", RunStatus.IN_PROGRESS).reply("t1", "done");
        TurnResult result = session.handleTurn("two").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(AssistantReply.class,
                reply -> assertThat(reply.runId()).isEqualTo("run-2"));
        List<String> calls = client.calls();
        assertThat(calls).containsSubsequence(
                "getLatestRun:t1",
                "getRunStatus:run-1",
                "cancelRun:run-1",
                "postMessage:t1:two",
                "createRun:t1:run-2"
        );
        assertThat(calls.indexOf("cancelRun:run-1")).isLessThan(calls.indexOf("postMessage:t1:two"));
        assertThat(session.isRunStateUnknown()).isFalse();
        assertThat(session.isIdle()).isTrue();
    }

    @Test
    void threadAdoptedFromDirectoryShouldSettleItsLatestRunFirst() throws Exception {
        threadDirectory.record("u1", "t1");
        client.defaultStatus("t1", RunStatus.IN_PROGRESS);
        ConversationSession previous = session("u1", sink);
        Disposable abandoned = previous.handleTurn("first").subscribe();
        awaitCondition(() -> previous.activeRun().isPresent());
        abandoned.dispose();

        client.defaultStatus("t1", RunStatus.COMPLETED).enqueueStatus("t1", RunStatus.IN_PROGRESS).reply("t1", "done");
        ConversationSession restarted = session("u1", sink);
        TurnResult result = restarted.handleTurn("second").block(WAIT);

        assertThat(result).isInstanceOf(AssistantReply.class);
        assertThat(client.calls()).containsSubsequence(
                "getLatestRun:t1",
                "cancelRun:run-1",
                "postMessage:t1:second",
                "createRun:t1:run-2"
        );
        assertThat(restarted.isIdle()).isTrue();
    }

    @Test
    void locallyFailedRunShouldBeReconciledBeforeNextMessage() {
        threadDirectory.record("u1", "t1");
        client.enqueueToolCalls("t1", new ToolCallRequest("call_1", "unknown_tool", Map.of()))
                .enqueueStatus("t1", RunStatus.REQUIRES_ACTION);
        ConversationSession session = session("u1", sink);

        TurnResult failed = session.handleTurn("first").block(WAIT);
        TurnResult next = session.handleTurn("second").block(WAIT);

        assertThat(failed).isInstanceOfSatisfying(TurnError.class,
                error -> assertThat(error.category()).isEqualTo(TurnErrorCategory.TOOL_FAILURE));
        assertThat(next).isInstanceOf(AssistantReply.class);
        assertThat(client.calls()).containsSubsequence(
                "getRunStatus:run-1",
                "cancelRun:run-1",
                "postMessage:t1:second",
                "createRun:t1:run-2"
        );
    }

    @Test
    void fatalCreateRunShouldReturnRemoteFatal() {
        threadDirectory.record("u1", "t1");
        client.failNextCreateRun(CallResult.fatal("createRun", 404, "No assistant found"));
        ConversationSession session = session("u1", sink);

        TurnResult result = session.handleTurn("hello").block(WAIT);

        assertThat(result).isInstanceOfSatisfying(TurnError.class, error -> {
            assertThat(error.category()).isEqualTo(TurnErrorCategory.REMOTE_FATAL);
            assertThat(error.turnSequence()).isEqualTo(1);
            assertThat(error.detail()).contains("No assistant found");
        });
        assertThat(session.orphanedRun()).isEmpty();
        assertThat(session.isRunStateUnknown()).isTrue();

        TurnResult retry = session.handleTurn("hello again").block(WAIT);

        assertThat(retry).isInstanceOf(AssistantReply.class);
        assertThat(client.calls()).containsSubsequence(
                "createRun:t1:failed",
                "getLatestRun:t1",
                "postMessage:t1:hello again",
                "createRun:t1:run-1"
        );
        assertThat(session.isIdle()).isTrue();
    }

    @Test
    void directoryWriteFailureShouldKeepThreadInMemory() {
        ThreadDirectory failingDirectory = mock(ThreadDirectory.class);
        when(failingDirectory.find("u1")).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("disk full")).when(failingDirectory).record(anyString(), anyString());
        ConversationSession session = new ConversationSession("u1", TestSessions.dependencies(
                client, TestSessions.runPoller(client, TestSessions.FAST_BUDGET), failingDirectory, sink));

        TurnResult first = session.handleTurn("one").block(WAIT);
        TurnResult second = session.handleTurn("two").block(WAIT);

        assertThat(first).isInstanceOf(AssistantReply.class);
        assertThat(second).isInstanceOf(AssistantReply.class);
        assertThat(session.threadId()).contains("thread-1");
        assertThat(client.count("createThread")).isEqualTo(1);
        verify(failingDirectory, times(1)).find("u1");
    }

    private ConversationSession session(String userId, RecordingNotificationSink notificationSink) {
        return new ConversationSession(userId, TestSessions.dependencies(
                client,
                TestSessions.runPoller(client, TestSessions.FAST_BUDGET),
                threadDirectory,
                notificationSink
        ));
    }

    private void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + WAIT);
            }
            Thread.sleep(5);
        }
    }
}
