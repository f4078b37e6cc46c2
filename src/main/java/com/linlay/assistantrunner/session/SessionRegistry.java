package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.client.RemoteAssistantClient;
import com.linlay.assistantrunner.config.SessionProperties;
import com.linlay.assistantrunner.model.TurnResult;
import com.linlay.assistantrunner.notification.NotificationSink;
import com.linlay.assistantrunner.run.RemoteCallExecutor;
import com.linlay.assistantrunner.run.RunPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide {@code userId -> ConversationSession} map with a cap on resident sessions.
 * <p>
 * Beyond the cap the least recently used idle sessions are dropped; their thread ids survive in the
 * {@link ThreadDirectory}. The registry lock only guards lookup, insert and eviction.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final SessionDependencies dependencies;
    private final int maxResidentSessions;
    private final LinkedHashMap<String, ConversationSession> sessions = new LinkedHashMap<>(16, 0.75f, true);
    private final Object lock = new Object();

    @Autowired
    public SessionRegistry(
            RemoteAssistantClient client,
            RunPoller runPoller,
            ThreadDirectory threadDirectory,
            NotificationSink notificationSink,
            ReplyFormatter replyFormatter,
            SessionProperties properties
    ) {
        this(
                new SessionDependencies(
                        client,
                        runPoller,
                        new RemoteCallExecutor(runPoller.budget()),
                        threadDirectory,
                        notificationSink,
                        replyFormatter,
                        new TurnHistory(properties.getHistoryCapacity())
                ),
                properties.getMaxResidentSessions()
        );
    }

    public SessionRegistry(SessionDependencies dependencies, int maxResidentSessions) {
        this.dependencies = dependencies;
        this.maxResidentSessions = Math.max(1, maxResidentSessions);
    }

    public ConversationSession getOrCreate(String userId) {
        String key = requireUserId(userId);
        synchronized (lock) {
            return getOrCreateLocked(key);
        }
    }

    /**
     * Drops and retires the local session of {@code userId}. Sessions with a turn in flight or a run
     * still to reconcile are kept.
     *
     * @return whether a session was removed
     */
    public boolean evict(String userId) {
        if (!StringUtils.hasText(userId)) {
            return false;
        }
        synchronized (lock) {
            ConversationSession session = sessions.get(userId.trim());
            if (session == null || !session.retireIfIdle()) {
                return false;
            }
            sessions.remove(userId.trim());
        }
        log.info("evicted session user={}", userId);
        return true;
    }

    public Mono<TurnResult> handleTurn(String userId, String text) {
        String key = requireUserId(userId);
        return Mono.defer(() -> {
            ConversationSession session;
            boolean acquired;
            synchronized (lock) {
                session = getOrCreateLocked(key);
                acquired = session.tryAcquireTurn();
            }
            return acquired ? session.runAcquiredTurn(text) : Mono.just(session.busy());
        });
    }

    public int sessionCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    public SessionStats stats() {
        synchronized (lock) {
            int inFlight = 0;
            int orphaned = 0;
            for (ConversationSession session : sessions.values()) {
                if (session.isTurnInFlight()) {
                    inFlight++;
                }
                if (session.orphanedRun().isPresent()) {
                    orphaned++;
                }
            }
            return new SessionStats(sessions.size(), maxResidentSessions, inFlight, orphaned);
        }
    }

    public List<TurnRecord> recentTurns(int limit) {
        return dependencies.turnHistory().recent(limit);
    }

    private ConversationSession getOrCreateLocked(String userId) {
        ConversationSession session = sessions.get(userId);
        if (session != null) {
            return session;
        }
        session = new ConversationSession(userId, dependencies);
        sessions.put(userId, session);
        evictIdleLocked(userId);
        return session;
    }

    private void evictIdleLocked(String keep) {
        if (sessions.size() <= maxResidentSessions) {
            return;
        }
        Iterator<Map.Entry<String, ConversationSession>> iterator = sessions.entrySet().iterator();
        while (sessions.size() > maxResidentSessions && iterator.hasNext()) {
            Map.Entry<String, ConversationSession> entry = iterator.next();
            if (entry.getKey().equals(keep) || !entry.getValue().retireIfIdle()) {
                continue;
            }
            iterator.remove();
            log.debug("evicted idle session user={}", entry.getKey());
        }
        if (sessions.size() > maxResidentSessions) {
            log.warn("resident sessions {} exceed cap {}, no idle session left to evict",
                    sessions.size(), maxResidentSessions);
        }
    }

    private static String requireUserId(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        return userId.trim();
    }
}
