package tw.gc.auto.strategylab.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfigurationLoader;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;
import tw.gc.auto.strategylab.services.search.SearchOptions;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardConfig;

/**
 * Turns {@link LabProperties} into the option objects the services are constructed with.
 */
@Configuration
@Slf4j
public class LabConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonMappers.json();
    }

    @Bean
    public YAMLMapper yamlMapper() {
        return JsonMappers.yaml();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExperimentStorage experimentStorage(LabProperties properties, ObjectMapper objectMapper,
                                               ExperimentConfigurationLoader configurationLoader) {
        Path resultsDir = Path.of(properties.getStorage().getResultsDir());
        log.info("📁 Experiment results under {}", resultsDir.toAbsolutePath());
        return new ExperimentStorage(resultsDir, objectMapper, configurationLoader);
    }

    @Bean
    public RunnerOptions runnerOptions(LabProperties properties) {
        LabProperties.Runner runner = properties.getRunner();
        return RunnerOptions.builder()
            .maxWorkers(runner.getMaxWorkers())
            .retryEnabled(runner.isRetryEnabled())
            .maxRetries(runner.getMaxRetries())
            .retryDelay(Duration.ofMillis(runner.getRetryDelayMs()))
            .failFast(runner.isFailFast())
            .flushEvery(runner.getFlushEvery())
            .retainRuns(runner.isRetainRuns())
            .rankingMetric(properties.getSearch().getMetric())
            .maximize(properties.getSearch().isMaximize())
            .build();
    }

    @Bean
    public SearchOptions searchOptions(LabProperties properties) {
        LabProperties.Search search = properties.getSearch();
        return SearchOptions.builder()
            .mode(SearchMode.fromValue(search.getMode()))
            .metric(search.getMetric())
            .maximize(search.isMaximize())
            .earlyStopping(search.isEarlyStopping())
            .patience(search.getPatience())
            .minImprovement(search.getMinImprovement())
            .batchSize(search.getBatchSize())
            .initialPoints(search.getInitialPoints())
            .callBudget(search.getCallBudget())
            .candidatePoolSize(search.getCandidatePoolSize())
            .seed(search.getSeed())
            .build();
    }

    @Bean
    public WalkForwardConfig walkForwardConfig(LabProperties properties) {
        LabProperties.WalkForward walkForward = properties.getWalkForward();
        return WalkForwardConfig.builder()
            .trainMonths(walkForward.getTrainMonths())
            .testMonths(walkForward.getTestMonths())
            .stepMonths(walkForward.getStepMonths())
            .metric(walkForward.getMetric())
            .maximize(walkForward.isMaximize())
            .minTrades(walkForward.getMinTrades())
            .recommendationThreshold(walkForward.getRecommendationThreshold())
            .searchMode(SearchMode.fromValue(walkForward.getSearchMode()))
            .build();
    }
}
