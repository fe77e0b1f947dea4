package tw.gc.auto.strategylab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "lab")
public class LabProperties {

    private Storage storage = new Storage();
    @Data
    public static class Storage {
        private String resultsDir = "data/experiments/results";
    }

    private Runner runner = new Runner();
    @Data
    public static class Runner {
        private int maxWorkers = 4;
        private boolean retryEnabled = true;
        private int maxRetries = 2;
        private long retryDelayMs = 500;
        private boolean failFast = false;
        private int flushEvery = 10;
        /**
         * When false, flushed run records are dropped from memory and the run log is the
         * only full record set.
         */
        private boolean retainRuns = true;
    }

    private Search search = new Search();
    @Data
    public static class Search {
        private String mode = "grid";
        private String metric = "sharpe_ratio";
        private boolean maximize = true;
        private boolean earlyStopping = false;
        private int patience = 10;
        private double minImprovement = 0.01;
        private int batchSize = 20;
        private int initialPoints = 10;
        /**
         * Model-based evaluations; unset falls back to max_combinations, then 100.
         */
        private Integer callBudget;
        private int candidatePoolSize = 500;
        private Long seed;
    }

    private WalkForward walkForward = new WalkForward();
    @Data
    public static class WalkForward {
        private int trainMonths = 6;
        private int testMonths = 2;
        private int stepMonths = 2;
        private String metric = "sharpe_ratio";
        private boolean maximize = true;
        private int minTrades = 5;
        private double recommendationThreshold = 70.0;
        private String searchMode = "grid";
    }
}
