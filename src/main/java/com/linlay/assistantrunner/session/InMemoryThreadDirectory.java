package com.linlay.assistantrunner.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryThreadDirectory implements ThreadDirectory {

    private final Map<String, String> threadsByUser = new ConcurrentHashMap<>();

    public InMemoryThreadDirectory() {
    }

    public InMemoryThreadDirectory(Map<String, String> initial) {
        if (initial != null) {
            threadsByUser.putAll(initial);
        }
    }

    @Override
    public Optional<String> find(String userId) {
        return Optional.ofNullable(userId == null ? null : threadsByUser.get(userId));
    }

    @Override
    public void record(String userId, String threadId) {
        threadsByUser.put(userId, threadId);
    }
}
