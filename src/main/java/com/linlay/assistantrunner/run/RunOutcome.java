package com.linlay.assistantrunner.run;

import com.linlay.assistantrunner.model.TurnErrorCategory;
import com.linlay.assistantrunner.model.TurnSideEffect;

import java.util.List;

public sealed interface RunOutcome permits RunOutcome.Completed, RunOutcome.Failed {

    RunHandle run();

    List<TurnSideEffect> sideEffects();

    int toolRounds();

    record Completed(
            RunHandle run,
            String replyText,
            List<TurnSideEffect> sideEffects,
            int toolRounds
    ) implements RunOutcome {
        public Completed {
            sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
        }
    }

    // a non-terminal lastStatus means the run may still be live
    record Failed(
            RunHandle run,
            TurnErrorCategory category,
            String detail,
            RunStatus lastStatus,
            List<TurnSideEffect> sideEffects,
            int toolRounds
    ) implements RunOutcome {
        public Failed {
            sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
        }

        public boolean runMayBeLive() {
            return lastStatus == null || !lastStatus.isTerminal();
        }
    }
}
