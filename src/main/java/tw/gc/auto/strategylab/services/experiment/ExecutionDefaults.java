package tw.gc.auto.strategylab.services.experiment;

/**
 * Execution settings handed to the backtest collaborator with every run.
 *
 * @param initialCash Starting capital
 * @param feeRate Fee rate per fill (0.0005 = 5 bps)
 * @param leverage Leverage multiplier
 * @param stopLossPct Optional stop-loss percentage
 * @param takeProfitPct Optional take-profit percentage
 */
public record ExecutionDefaults(
    double initialCash,
    double feeRate,
    double leverage,
    Double stopLossPct,
    Double takeProfitPct
) {
    public static final double DEFAULT_INITIAL_CASH = 10_000.0;
    public static final double DEFAULT_FEE_RATE = 0.0005;
    public static final double DEFAULT_LEVERAGE = 1.0;

    public ExecutionDefaults {
        if (!(initialCash > 0)) {
            throw new InvalidConfigurationException("initial_cash must be positive, got: " + initialCash);
        }
        if (!(feeRate >= 0)) {
            throw new InvalidConfigurationException("fee_rate must be non-negative, got: " + feeRate);
        }
        if (!(leverage > 0)) {
            throw new InvalidConfigurationException("leverage must be positive, got: " + leverage);
        }
        if (stopLossPct != null && !(stopLossPct > 0)) {
            throw new InvalidConfigurationException("stop_loss_pct must be positive, got: " + stopLossPct);
        }
        if (takeProfitPct != null && !(takeProfitPct > 0)) {
            throw new InvalidConfigurationException("take_profit_pct must be positive, got: " + takeProfitPct);
        }
    }

    public static ExecutionDefaults defaults() {
        return new ExecutionDefaults(DEFAULT_INITIAL_CASH, DEFAULT_FEE_RATE, DEFAULT_LEVERAGE, null, null);
    }
}
