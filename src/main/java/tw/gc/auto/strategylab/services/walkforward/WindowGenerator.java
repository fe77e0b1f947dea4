package tw.gc.auto.strategylab.services.walkforward;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Slices a date range into forward-advancing train/test window pairs.
 *
 * <pre>
 * start                                                           end
 *   |── train 0 ──────────|── test 0 ──|
 *   ·  step  |── train 1 ──────────|── test 1 ──|
 *   ·        ·  step  |── train 2 ──────────|── test 2 ──|
 * </pre>
 *
 * <p>Window {@code i} trains from {@code start + i × step} months; its test period starts
 * exactly where training ends. Generation stops at the first window whose test end would pass
 * {@code end}. Train periods of consecutive windows overlap whenever step is shorter than train.
 */
@Component
@Slf4j
public class WindowGenerator {

    public List<WalkForwardWindow> generate(LocalDate start, LocalDate end, WalkForwardConfig config) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Walk-forward needs both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start (%s) must not be after end (%s)".formatted(start, end));
        }
        List<WalkForwardWindow> windows = new ArrayList<>();
        for (int index = 0; ; index++) {
            // offsets from the anchor, so month-end days do not drift across windows
            LocalDate trainStart = start.plusMonths((long) index * config.stepMonths());
            LocalDate trainEnd = trainStart.plusMonths(config.trainMonths());
            LocalDate testStart = trainEnd;
            LocalDate testEnd = testStart.plusMonths(config.testMonths());
            if (testEnd.isAfter(end)) {
                break;
            }
            windows.add(new WalkForwardWindow(index, trainStart, trainEnd, testStart, testEnd));
        }
        if (windows.isEmpty()) {
            log.warn("⚠️ No walk-forward window fits {} → {} (train {}m + test {}m)",
                start, end, config.trainMonths(), config.testMonths());
        }
        return windows;
    }
}
