package tw.gc.auto.strategylab.services.runner;

/**
 * Typed failure raised by a backtest function. Captured on the run record and never
 * propagated past the batch runner.
 */
public class BacktestException extends Exception {

    public BacktestException(String message) {
        super(message);
    }

    public BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
