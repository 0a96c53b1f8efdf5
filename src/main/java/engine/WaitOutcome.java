package engine;

/**
 * wait_any 的恢复原因
 */
public enum WaitOutcome {
    SIGNALLED,
    TIMED_OUT
}
