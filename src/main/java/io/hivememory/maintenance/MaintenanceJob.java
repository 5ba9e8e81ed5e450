package io.hivememory.maintenance;

import io.hivememory.pattern.ConsolidationResult;
import io.hivememory.pattern.PatternConsolidator;
import org.jobrunr.jobs.annotations.Job;
import org.springframework.stereotype.Component;

/**
 * Recurring maintenance work run by JobRunr.
 */
@Component
public class MaintenanceJob {

    private final TtlSweeper ttlSweeper;
    private final PatternConsolidator consolidator;

    public MaintenanceJob(TtlSweeper ttlSweeper, PatternConsolidator consolidator) {
        this.ttlSweeper = ttlSweeper;
        this.consolidator = consolidator;
    }

    @Job(name = "TTL sweep")
    public SweepResult sweep() {
        return ttlSweeper.sweep();
    }

    @Job(name = "Pattern consolidation")
    public ConsolidationResult consolidate() {
        return consolidator.consolidate();
    }
}
