package tw.gc.auto.strategylab.enums;

/**
 * Outcome attached to every derived statistic, so callers branch on a value
 * instead of catching exceptions.
 */
public enum StatisticStatus {
    SUCCESS,
    INSUFFICIENT_DATA,
    FAILED;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
