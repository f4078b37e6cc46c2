package com.linlay.assistantrunner.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

public class TurnHistory {

    private final int capacity;
    private final Deque<TurnRecord> records = new ArrayDeque<>();

    public TurnHistory(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void record(TurnRecord record) {
        if (record == null) {
            return;
        }
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    public synchronized List<TurnRecord> recent(int limit) {
        int safeLimit = Math.max(0, Math.min(limit, records.size()));
        List<TurnRecord> recent = new ArrayList<>(safeLimit);
        Iterator<TurnRecord> iterator = records.descendingIterator();
        while (iterator.hasNext() && recent.size() < safeLimit) {
            recent.add(iterator.next());
        }
        return recent;
    }

    public synchronized int size() {
        return records.size();
    }
}
