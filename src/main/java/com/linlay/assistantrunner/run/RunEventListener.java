package com.linlay.assistantrunner.run;

@FunctionalInterface
public interface RunEventListener {

    void onEvent(RunEvent event);
}
