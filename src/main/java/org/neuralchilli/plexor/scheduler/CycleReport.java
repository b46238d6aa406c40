package org.neuralchilli.plexor.scheduler;

import org.neuralchilli.plexor.reconcile.ReconcileReport;

/**
 * Outcome of one scheduler cycle.
 */
public record CycleReport(
        int activeRuns,
        int dispatched,
        int conflicts,
        int dispatchFailures,
        int cancelled,
        int skipped,
        ReconcileReport reconciled,
        int finishedRuns
) {
    public boolean isIdle() {
        return dispatched == 0
                && dispatchFailures == 0
                && cancelled == 0
                && skipped == 0
                && finishedRuns == 0
                && reconciled.isEmpty();
    }
}
