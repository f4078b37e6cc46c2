package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.model.AssistantReply;
import com.linlay.assistantrunner.model.EscalationRequest;
import com.linlay.assistantrunner.model.ExtractedContact;
import com.linlay.assistantrunner.model.TurnError;
import com.linlay.assistantrunner.model.TurnErrorCategory;
import com.linlay.assistantrunner.model.TurnFailedException;
import com.linlay.assistantrunner.model.TurnResult;
import com.linlay.assistantrunner.model.TurnSideEffect;
import com.linlay.assistantrunner.run.RunHandle;
import com.linlay.assistantrunner.run.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One user's conversation: owns the thread identity and keeps turns strictly sequential.
 * <p>
 * At most one turn is in flight; a second concurrent turn is answered with
 * {@link TurnErrorCategory#BUSY}. A run left behind by a cancelled or failed turn is recorded as
 * orphaned and brought to a terminal state before the next message is posted. When the session cannot
 * tell whether a run exists on its thread (a run creation whose response never arrived, or a thread
 * adopted from the {@link ThreadDirectory}), the thread's latest run is looked up and settled first.
 * <p>
 * A session removed from the {@link SessionRegistry} is retired and answers every later turn with BUSY.
 */
public class ConversationSession {

    private static final Logger log = LoggerFactory.getLogger(ConversationSession.class);

    private final String userId;
    private final SessionDependencies dependencies;
    private final AtomicBoolean turnInFlight = new AtomicBoolean(false);
    private final AtomicLong turnSequence = new AtomicLong();

    private volatile String threadId;
    private volatile RunHandle activeRun;
    private volatile RunHandle orphanedRun;
    private volatile boolean runStateUnknown;
    private volatile boolean retired;

    public ConversationSession(String userId, SessionDependencies dependencies) {
        this.userId = userId;
        this.dependencies = dependencies;
    }

    public Mono<TurnResult> handleTurn(String text) {
        return Mono.defer(() -> tryAcquireTurn() ? runAcquiredTurn(text) : Mono.just(busy()));
    }

    boolean tryAcquireTurn() {
        return turnInFlight.compareAndSet(false, true);
    }

    TurnError busy() {
        String detail = retired
                ? "Session of user " + userId + " was evicted"
                : "A turn is already in flight for user " + userId;
        return new TurnError(userId, 0, TurnErrorCategory.BUSY, detail);
    }

    /**
     * Takes the in-flight flag for good if the session is idle. Called by the registry, under its lock,
     * before the session is dropped.
     */
    boolean retireIfIdle() {
        if (orphanedRun != null || runStateUnknown || !turnInFlight.compareAndSet(false, true)) {
            return false;
        }
        retired = true;
        return true;
    }

    /**
     * Runs a turn whose in-flight flag was already taken by {@link #tryAcquireTurn()}. The flag is
     * released before the result is emitted, or when the returned {@link Mono} is cancelled.
     */
    Mono<TurnResult> runAcquiredTurn(String text) {
        long sequence = turnSequence.incrementAndGet();
        Instant startedAt = Instant.now();
        AtomicBoolean released = new AtomicBoolean(false);
        return Mono.defer(() -> resolveThread()
                        .flatMap(thread -> reconcileThread(thread).thenReturn(thread))
                        .flatMap(thread -> dependencies.callExecutor()
                                .call("postMessage", () -> dependencies.client().postMessage(thread, text))
                                .thenReturn(thread))
                        .flatMap(this::createRun)
                        .flatMap(run -> dependencies.runPoller().drive(userId, run))
                        .map(outcome -> toResult(sequence, startedAt, outcome)))
                .onErrorResume(TurnFailedException.class, ex -> Mono.just(toError(sequence, startedAt, ex)))
                .doOnNext(result -> releaseTurn(released, SignalType.ON_NEXT))
                .doFinally(signal -> releaseTurn(released, signal));
    }

    private Mono<String> resolveThread() {
        String known = threadId;
        if (known != null) {
            return Mono.just(known);
        }
        return Mono.fromCallable(() -> dependencies.threadDirectory().find(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(found -> found.map(this::adoptRecordedThread).orElseGet(this::createThread))
                .doOnNext(id -> threadId = id);
    }

    private Mono<String> adoptRecordedThread(String id) {
        // an earlier session may have left a run on this thread
        runStateUnknown = true;
        return Mono.just(id);
    }

    private Mono<String> createThread() {
        return dependencies.callExecutor().call("createThread", () -> dependencies.client().createThread())
                .flatMap(id -> Mono.fromCallable(() -> {
                            dependencies.threadDirectory().record(userId, id);
                            log.info("created thread {} for user={}", id, userId);
                            return id;
                        })
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(IllegalStateException.class, ex -> {
                            log.warn("thread {} of user={} could not be recorded, it is kept in memory only", id, userId, ex);
                            return Mono.just(id);
                        }));
    }

    private Mono<RunHandle> createRun(String thread) {
        // stays set until the handle arrives: a lost or abandoned response may still have created the run
        runStateUnknown = true;
        return dependencies.callExecutor().call("createRun", () -> dependencies.client().createRun(thread))
                .doOnNext(run -> {
                    activeRun = run;
                    runStateUnknown = false;
                });
    }

    private Mono<Void> reconcileThread(String thread) {
        return reconcileOrphan().then(Mono.defer(() -> runStateUnknown ? reconcileLatestRun(thread) : Mono.<Void>empty()));
    }

    private Mono<Void> reconcileLatestRun(String thread) {
        return dependencies.callExecutor().call("getLatestRun", () -> dependencies.client().getLatestRun(thread))
                .flatMap(latest -> latest
                        .map(run -> dependencies.runPoller().settleOrphan(userId, run)
                                .doOnNext(status -> log.info("latest run {} on thread {} of user={} settled with status={}",
                                        run.runId(), thread, userId, status))
                                .then())
                        .orElseGet(Mono::empty))
                .doOnSuccess(ignored -> runStateUnknown = false);
    }

    private Mono<Void> reconcileOrphan() {
        RunHandle orphan = orphanedRun;
        if (orphan == null) {
            return Mono.empty();
        }
        return dependencies.runPoller().settleOrphan(userId, orphan)
                .doOnNext(status -> {
                    log.info("orphaned run {} of user={} settled with status={}", orphan.runId(), userId, status);
                    orphanedRun = null;
                })
                .then();
    }

    private TurnResult toResult(long sequence, Instant startedAt, RunOutcome outcome) {
        activeRun = null;
        deliverSideEffects(outcome.sideEffects());
        RunHandle run = outcome.run();
        if (outcome instanceof RunOutcome.Failed failed) {
            if (failed.runMayBeLive()) {
                orphanedRun = run;
                log.warn("run {} of user={} left in status={}, it will be reconciled before the next turn",
                        run.runId(), userId, failed.lastStatus());
            }
            record(sequence, startedAt, run, failed.category(), outcome.toolRounds());
            return new TurnError(userId, sequence, failed.category(), failed.detail());
        }
        RunOutcome.Completed completed = (RunOutcome.Completed) outcome;
        List<ExtractedContact> contacts = new ArrayList<>();
        List<EscalationRequest> escalations = new ArrayList<>();
        for (TurnSideEffect sideEffect : completed.sideEffects()) {
            if (sideEffect instanceof ExtractedContact contact) {
                contacts.add(contact);
            } else if (sideEffect instanceof EscalationRequest escalation) {
                escalations.add(escalation);
            }
        }
        record(sequence, startedAt, run, null, outcome.toolRounds());
        return new AssistantReply(
                userId,
                sequence,
                run.threadId(),
                run.runId(),
                dependencies.replyFormatter().format(completed.replyText()),
                contacts,
                escalations
        );
    }

    private TurnError toError(long sequence, Instant startedAt, TurnFailedException ex) {
        log.warn("turn {} of user={} failed category={}: {}", sequence, userId, ex.category(), ex.getMessage());
        record(sequence, startedAt, null, ex.category(), 0);
        return new TurnError(userId, sequence, ex.category(), ex.getMessage());
    }

    private void deliverSideEffects(List<TurnSideEffect> sideEffects) {
        for (TurnSideEffect sideEffect : sideEffects) {
            try {
                dependencies.notificationSink().deliver(sideEffect);
            } catch (RuntimeException ex) {
                log.warn("notification of {} failed for user={}", sideEffect.getClass().getSimpleName(), userId, ex);
            }
        }
    }

    private void record(long sequence, Instant startedAt, RunHandle run, TurnErrorCategory category, int toolRounds) {
        dependencies.turnHistory().record(new TurnRecord(
                userId,
                sequence,
                run == null ? threadId : run.threadId(),
                run == null ? null : run.runId(),
                category == null,
                category,
                startedAt,
                Duration.between(startedAt, Instant.now()).toMillis(),
                toolRounds
        ));
    }

    private void releaseTurn(AtomicBoolean released, SignalType signal) {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        RunHandle live = activeRun;
        if (live != null) {
            orphanedRun = live;
            activeRun = null;
            log.warn("turn of user={} ended with signal={} while run {} was active, run recorded as orphaned",
                    userId, signal, live.runId());
        } else if (runStateUnknown) {
            log.warn("turn of user={} ended with signal={} before run creation was confirmed, "
                    + "the thread's latest run will be reconciled first", userId, signal);
        }
        turnInFlight.set(false);
    }

    public String userId() {
        return userId;
    }

    public Optional<String> threadId() {
        return Optional.ofNullable(threadId);
    }

    public Optional<RunHandle> activeRun() {
        return Optional.ofNullable(activeRun);
    }

    public Optional<RunHandle> orphanedRun() {
        return Optional.ofNullable(orphanedRun);
    }

    public long turnSequence() {
        return turnSequence.get();
    }

    public boolean isTurnInFlight() {
        return turnInFlight.get();
    }

    public boolean isRunStateUnknown() {
        return runStateUnknown;
    }

    public boolean isRetired() {
        return retired;
    }

    /**
     * Idle sessions hold no in-flight turn and nothing left to reconcile, and may be evicted.
     */
    public boolean isIdle() {
        return !turnInFlight.get() && orphanedRun == null && !runStateUnknown;
    }
}
