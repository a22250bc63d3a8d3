package com.telcobright.archive.db.scheduler;

import com.telcobright.archive.core.config.MaintenanceConfig;
import com.telcobright.archive.db.maintenance.MaintenanceResult;
import com.telcobright.archive.db.maintenance.PartitionMaintenanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs partition maintenance once a day at the configured adjustment time.
 *
 * Daily runs keep every granularity at least one bucket ahead of real
 * time. A failed run is logged and retried at the next slot.
 */
public class PartitionScheduler {
    
    private static final Logger logger = LoggerFactory.getLogger(PartitionScheduler.class);
    
    private final PartitionMaintenanceService maintenanceService;
    private final MaintenanceConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<MaintenanceResult> lastResult = new AtomicReference<>();
    private boolean started = false;
    
    public PartitionScheduler(PartitionMaintenanceService maintenanceService, MaintenanceConfig config, Clock clock) {
        this.maintenanceService = maintenanceService;
        this.config = config;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("partition-scheduler-" + config.getSchema());
            t.setDaemon(true);
            return t;
        });
    }
    
    /**
     * Start the scheduler - calculates initial delay to next adjustment time
     */
    public synchronized void start() {
        if (started) {
            logger.warn("Partition scheduler for {} already started", config.getSchema());
            return;
        }
        
        long initialDelay = calculateInitialDelay();
        scheduler.scheduleAtFixedRate(
            this::performMaintenance,
            initialDelay,
            TimeUnit.DAYS.toSeconds(1),
            TimeUnit.SECONDS
        );
        
        started = true;
        logger.info("Partition scheduler started for {} - next maintenance in {} seconds",
            config.getSchema(), initialDelay);
    }
    
    /**
     * Stop the scheduler
     */
    public synchronized void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        started = false;
        logger.info("Partition scheduler stopped for {}", config.getSchema());
    }
    
    public synchronized boolean isStarted() {
        return started;
    }
    
    /**
     * Run maintenance now on the scheduler thread, outside the daily slot.
     */
    public void triggerMaintenance() {
        logger.info("Triggering manual partition maintenance for {}", config.getSchema());
        scheduler.execute(this::performMaintenance);
    }
    
    /**
     * Result of the most recent successful run, or null before the first one.
     */
    public MaintenanceResult getLastResult() {
        return lastResult.get();
    }
    
    private void performMaintenance() {
        try {
            lastResult.set(maintenanceService.runMaintenance(config));
        } catch (Exception e) {
            // Keep the schedule alive; the next slot retries
            logger.error("Error during partition maintenance for {}", config.getSchema(), e);
        }
    }
    
    /**
     * Seconds until the next adjustment time
     */
    long calculateInitialDelay() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime nextRun = now.toLocalDate().atTime(config.getAdjustmentTime());
        
        // If target time has already passed today, schedule for tomorrow
        if (!nextRun.isAfter(now)) {
            nextRun = nextRun.plusDays(1);
        }
        
        return Duration.between(now, nextRun).getSeconds();
    }
}
