package com.linlay.assistantrunner.session;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TurnHistoryTest {

    @Test
    void shouldKeepNewestRecordsWithinCapacity() {
        TurnHistory history = new TurnHistory(2);

        history.record(record(1));
        history.record(record(2));
        history.record(record(3));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.recent(10)).extracting(TurnRecord::turnSequence).containsExactly(3L, 2L);
        assertThat(history.recent(1)).extracting(TurnRecord::turnSequence).containsExactly(3L);
        assertThat(history.recent(0)).isEmpty();
    }

    private TurnRecord record(long sequence) {
        return new TurnRecord("u1", sequence, "t1", "run-" + sequence, true, null, Instant.now(), 5, 0);
    }
}
