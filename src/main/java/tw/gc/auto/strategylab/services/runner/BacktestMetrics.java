package tw.gc.auto.strategylab.services.runner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Metrics produced by a single backtest: a fixed core set plus open extension values.
 *
 * @param totalReturn Total return as a fraction (0.15 = 15%)
 * @param maxDrawdown Maximum drawdown as a fraction, reported as a negative number or zero
 * @param sharpeRatio Risk-adjusted return ratio
 * @param numTrades Number of closed trades
 * @param winRate Share of winning trades
 * @param profitFactor Gross profit divided by gross loss
 * @param extra Additional named metrics
 */
@Builder(toBuilder = true)
public record BacktestMetrics(
    @JsonProperty("total_return") double totalReturn,
    @JsonProperty("max_drawdown") double maxDrawdown,
    @JsonProperty("sharpe_ratio") double sharpeRatio,
    @JsonProperty("num_trades") int numTrades,
    @JsonProperty("win_rate") double winRate,
    @JsonProperty("profit_factor") double profitFactor,
    @JsonProperty("extra") Map<String, Double> extra
) {
    public static final String TOTAL_RETURN = "total_return";
    public static final String MAX_DRAWDOWN = "max_drawdown";
    public static final String SHARPE_RATIO = "sharpe_ratio";
    public static final String NUM_TRADES = "num_trades";
    public static final String WIN_RATE = "win_rate";
    public static final String PROFIT_FACTOR = "profit_factor";

    public BacktestMetrics {
        if (numTrades < 0) {
            throw new IllegalArgumentException("numTrades cannot be negative: " + numTrades);
        }
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Looks up a metric by its snake_case name, core metrics first.
     *
     * @return the value, or empty when unknown or not a finite number
     */
    public OptionalDouble value(String metric) {
        double v;
        switch (metric) {
            case TOTAL_RETURN -> v = totalReturn;
            case MAX_DRAWDOWN -> v = maxDrawdown;
            case SHARPE_RATIO -> v = sharpeRatio;
            case NUM_TRADES -> v = numTrades;
            case WIN_RATE -> v = winRate;
            case PROFIT_FACTOR -> v = profitFactor;
            default -> {
                Double found = extra.get(metric);
                if (found == null) {
                    return OptionalDouble.empty();
                }
                v = found;
            }
        }
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    /**
     * Builds metrics from a loosely typed map; unknown numeric keys go to {@code extra}.
     */
    public static BacktestMetrics fromMap(Map<String, ?> values) {
        BacktestMetricsBuilder builder = builder();
        Map<String, Double> extra = new LinkedHashMap<>();
        values.forEach((key, raw) -> {
            if (!(raw instanceof Number number)) {
                return;
            }
            double v = number.doubleValue();
            switch (key) {
                case TOTAL_RETURN -> builder.totalReturn(v);
                case MAX_DRAWDOWN -> builder.maxDrawdown(v);
                case SHARPE_RATIO -> builder.sharpeRatio(v);
                case NUM_TRADES -> builder.numTrades(number.intValue());
                case WIN_RATE -> builder.winRate(v);
                case PROFIT_FACTOR -> builder.profitFactor(v);
                default -> extra.put(key, v);
            }
        });
        return builder.extra(extra).build();
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(TOTAL_RETURN, totalReturn);
        map.put(MAX_DRAWDOWN, maxDrawdown);
        map.put(SHARPE_RATIO, sharpeRatio);
        map.put(NUM_TRADES, (double) numTrades);
        map.put(WIN_RATE, winRate);
        map.put(PROFIT_FACTOR, profitFactor);
        map.putAll(extra);
        return map;
    }
}
