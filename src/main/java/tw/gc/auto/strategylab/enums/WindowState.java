package tw.gc.auto.strategylab.enums;

/**
 * Walk-forward window progression. VALIDATED is only reachable from OPTIMIZED.
 */
public enum WindowState {
    PENDING,
    OPTIMIZED,
    VALIDATED
}
