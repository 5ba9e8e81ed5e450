package io.hivememory.maintenance;

import io.hivememory.config.MemoryProperties;
import io.hivememory.pattern.ConsolidationResult;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the TTL sweep and pattern consolidation as JobRunr recurring jobs on
 * application start-up.
 */
@Service
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);
    static final String SWEEP_JOB_ID = "hivememory-ttl-sweep";
    static final String CONSOLIDATION_JOB_ID = "hivememory-pattern-consolidation";

    private final JobScheduler jobScheduler;
    private final MaintenanceJob maintenanceJob;
    private final MemoryProperties.Maintenance config;

    public MaintenanceService(JobScheduler jobScheduler, MaintenanceJob maintenanceJob, MemoryProperties properties) {
        this.jobScheduler = jobScheduler;
        this.maintenanceJob = maintenanceJob;
        this.config = properties.maintenance();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!config.enabled()) {
            log.info("Maintenance jobs disabled via configuration");
            return;
        }

        jobScheduler.<MaintenanceJob>scheduleRecurrently(SWEEP_JOB_ID,
                config.sweepInterval(),
                x -> x.sweep());
        log.info("TTL sweep registered: every {}", config.sweepInterval());

        jobScheduler.<MaintenanceJob>scheduleRecurrently(CONSOLIDATION_JOB_ID,
                config.consolidationCron(),
                x -> x.consolidate());
        log.info("Pattern consolidation registered with cron: {}", config.consolidationCron());
    }

    /**
     * Runs a TTL sweep immediately, outside the schedule.
     */
    public SweepResult sweepNow() {
        log.info("Triggering immediate TTL sweep");
        return maintenanceJob.sweep();
    }

    /**
     * Runs pattern consolidation immediately, outside the schedule.
     */
    public ConsolidationResult consolidateNow() {
        log.info("Triggering immediate pattern consolidation");
        return maintenanceJob.consolidate();
    }

    public void stop() {
        jobScheduler.deleteRecurringJob(SWEEP_JOB_ID);
        jobScheduler.deleteRecurringJob(CONSOLIDATION_JOB_ID);
        log.info("Maintenance jobs stopped");
    }
}
