package com.linlay.assistantrunner.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingRunEventListener implements RunEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRunEventListener.class);

    @Override
    public void onEvent(RunEvent event) {
        switch (event.type()) {
            case POLL_SCHEDULED -> log.debug("run poll scheduled user={}, run={}, status={}, delayMs={}",
                    event.userId(), event.run().runId(), event.status(), event.delay().toMillis());
            case TRANSIENT_FAILURE -> log.warn("run poll transient failure user={}, run={}: {}",
                    event.userId(), event.run().runId(), event.detail());
            case TERMINAL -> log.info("run finished user={}, thread={}, run={}, status={}, {}",
                    event.userId(), event.run().threadId(), event.run().runId(), event.status(), event.detail());
            default -> log.debug("run event {} user={}, run={}, status={}, {}",
                    event.type(), event.userId(), event.run().runId(), event.status(), event.detail());
        }
    }
}
