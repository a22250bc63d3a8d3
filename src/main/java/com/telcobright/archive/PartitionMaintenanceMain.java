package com.telcobright.archive;

import com.telcobright.archive.core.config.DataSourceConfig;
import com.telcobright.archive.core.config.MaintenanceConfig;
import com.telcobright.archive.db.connection.ConnectionProvider;
import com.telcobright.archive.db.maintenance.MaintenanceResult;
import com.telcobright.archive.db.maintenance.PartitionMaintenanceService;
import com.telcobright.archive.db.scheduler.PartitionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point, meant to be called from cron:
 *
 * <pre>
 *   java -jar sample-archive-partitions.jar /etc/archive/maintenance.properties
 *   java -jar sample-archive-partitions.jar /etc/archive/maintenance.properties --schedule
 * </pre>
 *
 * Without --schedule a single maintenance pass runs and the number of
 * created buckets is printed. With it, maintenance runs once at startup and
 * then daily at the configured adjustment time until the process is stopped.
 */
public class PartitionMaintenanceMain {

    private static final Logger logger = LoggerFactory.getLogger(PartitionMaintenanceMain.class);

    private static final String DEFAULTS_RESOURCE = "/archive-maintenance.properties";

    public static void main(String[] args) throws Exception {
        String configPath = null;
        boolean schedule = false;
        for (String arg : args) {
            if ("--schedule".equals(arg)) {
                schedule = true;
            } else {
                configPath = arg;
            }
        }

        Properties properties = loadProperties(configPath);
        MaintenanceConfig maintenanceConfig = MaintenanceConfig.fromProperties(properties);
        DataSourceConfig dataSourceConfig = DataSourceConfig.fromProperties(properties);
        Clock clock = Clock.system(maintenanceConfig.getZone());

        ConnectionProvider connectionProvider = new ConnectionProvider(dataSourceConfig);
        PartitionMaintenanceService service = new PartitionMaintenanceService(
            connectionProvider, clock, maintenanceConfig.getDispatchStrategy());

        if (!schedule) {
            try {
                MaintenanceResult result = service.runMaintenance(maintenanceConfig);
                System.out.println(result.getCreatedCount());
            } finally {
                connectionProvider.shutdown();
            }
            return;
        }

        PartitionScheduler scheduler = new PartitionScheduler(service, maintenanceConfig, clock);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            connectionProvider.shutdown();
            stopped.countDown();
        }, "partition-maintenance-shutdown"));

        scheduler.triggerMaintenance();
        scheduler.start();
        logger.info("Partition maintenance scheduled for {}", maintenanceConfig);
        stopped.await();
    }

    /**
     * Classpath defaults overlaid with the given file, if any.
     */
    static Properties loadProperties(String configPath) throws IOException {
        Properties properties = new Properties();
        try (InputStream defaults = PartitionMaintenanceMain.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (defaults != null) {
                properties.load(defaults);
            }
        }
        if (configPath != null) {
            try (Reader reader = Files.newBufferedReader(Path.of(configPath), StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        }
        return properties;
    }
}
