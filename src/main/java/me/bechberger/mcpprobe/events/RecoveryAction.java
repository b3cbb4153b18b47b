package me.bechberger.mcpprobe.events;

/**
 * What the caller should do after an error was reported.
 */
public enum RecoveryAction {
    /** Run the failed step again */
    RETRY,
    /** Continue with the next step */
    SKIP,
    /** Undo work done so far, then stop */
    ROLLBACK,
    /** Stop */
    ABORT,
    /** Stop and leave the fix to a human */
    MANUAL;

    /**
     * Whether the run stops after this action
     */
    public boolean stopsRun() {
        return this != RETRY && this != SKIP;
    }
}
