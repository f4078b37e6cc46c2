package com.linlay.assistantrunner.session;

import java.util.Optional;

/**
 * Durable mapping of users to their remote thread. A thread id, once recorded, is never reassigned.
 */
public interface ThreadDirectory {

    Optional<String> find(String userId);

    void record(String userId, String threadId);
}
