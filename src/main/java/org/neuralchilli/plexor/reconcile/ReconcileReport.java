package org.neuralchilli.plexor.reconcile;

/**
 * Outcome of one reconciliation pass.
 *
 * @param applied           state changes that moved a task instance or refreshed its assignment
 * @param ignored           unknown, stale or duplicate state changes
 * @param cancellationsSent cancel requests forwarded to executors
 * @param orphans           assignments dropped for missing heartbeats
 */
public record ReconcileReport(
        int applied,
        int ignored,
        int cancellationsSent,
        int orphans
) {
    public static ReconcileReport empty() {
        return new ReconcileReport(0, 0, 0, 0);
    }

    public boolean isEmpty() {
        return applied == 0 && cancellationsSent == 0 && orphans == 0;
    }
}
