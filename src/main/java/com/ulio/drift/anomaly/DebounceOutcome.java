package com.ulio.drift.anomaly;

import java.util.Collections;
import java.util.List;

public class DebounceOutcome {
    private final List<AnomalyEvent> sustained;
    private final List<RecoveryTransition> recoveries;

    public DebounceOutcome(List<AnomalyEvent> sustained, List<RecoveryTransition> recoveries) {
        this.sustained = sustained == null ? Collections.emptyList() : List.copyOf(sustained);
        this.recoveries = recoveries == null ? Collections.emptyList() : List.copyOf(recoveries);
    }

    public List<AnomalyEvent> getSustained() {
        return sustained;
    }

    public List<RecoveryTransition> getRecoveries() {
        return recoveries;
    }
}
