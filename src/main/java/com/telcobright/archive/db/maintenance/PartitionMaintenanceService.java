package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.config.MaintenanceConfig;
import com.telcobright.archive.core.exception.ConfigurationException;
import com.telcobright.archive.core.exception.PartitionMaintenanceException;
import com.telcobright.archive.core.metadata.SampleTableMetadata;
import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.Granularity;
import com.telcobright.archive.core.routing.DispatchStrategy;
import com.telcobright.archive.core.routing.DispatchTable;
import com.telcobright.archive.core.sql.postgresql.DispatchRoutineGenerator;
import com.telcobright.archive.core.sql.postgresql.PostgreSQLDdlGenerator;
import com.telcobright.archive.db.catalog.PartitionCatalog;
import com.telcobright.archive.db.catalog.PostgreSQLPartitionCatalog;
import com.telcobright.archive.db.connection.ConnectionProvider;
import com.telcobright.archive.db.connection.MaintenanceLock;
import com.telcobright.archive.db.schema.SampleSchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entry point of partition maintenance: update_partitions(begin_time, schema, owner, plan).
 *
 * A run holds the maintenance lock for the parent table, materializes the
 * missing buckets (each in its own transaction) and only then rebuilds the
 * dispatch routine in a separate transaction. The routine routes to every
 * physical bucket of the granularity, not just the run window, so moving
 * beginTime forward never orphans older buckets.
 */
public class PartitionMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(PartitionMaintenanceService.class);

    private final ConnectionProvider connectionProvider;
    private final PartitionCatalog catalog;
    private final PartitionCatalogSynchronizer synchronizer;
    private final RouterCompiler routerCompiler;
    private final SampleSchemaInitializer schemaInitializer;

    public PartitionMaintenanceService(ConnectionProvider connectionProvider, Clock clock, DispatchStrategy strategy) {
        this(connectionProvider, clock, strategy, new PostgreSQLDdlGenerator());
    }

    private PartitionMaintenanceService(ConnectionProvider connectionProvider, Clock clock, DispatchStrategy strategy,
                                        PostgreSQLDdlGenerator ddl) {
        this(connectionProvider,
             new PostgreSQLPartitionCatalog(connectionProvider.getDataSource(), ddl),
             clock,
             strategy,
             new SampleSchemaInitializer(connectionProvider.getDataSource(), ddl));
    }

    public PartitionMaintenanceService(ConnectionProvider connectionProvider, PartitionCatalog catalog, Clock clock,
                                       DispatchStrategy strategy, SampleSchemaInitializer schemaInitializer) {
        this.connectionProvider = connectionProvider;
        this.catalog = catalog;
        this.synchronizer = new PartitionCatalogSynchronizer(catalog, clock);
        this.routerCompiler = new RouterCompiler(catalog,
            new DispatchRoutineGenerator(new PostgreSQLDdlGenerator()), strategy);
        this.schemaInitializer = schemaInitializer;
    }

    /**
     * Run maintenance and return the number of newly created buckets.
     *
     * @throws com.telcobright.archive.core.exception.InvalidGranularityException for an unknown plan, before any DDL
     * @throws com.telcobright.archive.core.exception.ConfigurationException if the owner or a lookup relation is missing
     * @throws com.telcobright.archive.core.exception.MaintenanceInProgressException if another run holds the lock
     */
    public int updatePartitions(LocalDateTime beginTime, String schema, String owner, String plan) {
        return runMaintenance(beginTime, schema, owner, plan).getCreatedCount();
    }

    public MaintenanceResult runMaintenance(LocalDateTime beginTime, String schema, String owner, String plan) {
        return runMaintenance(beginTime, schema, owner, Granularity.fromPlan(plan), false);
    }

    /**
     * Run maintenance with the arguments of a configured job, creating the
     * parent table first when the configuration asks for it.
     */
    public MaintenanceResult runMaintenance(MaintenanceConfig config) {
        return runMaintenance(config.getBeginTime(), config.getSchema(), config.getOwner(),
            config.getGranularity(), config.isCreateParentTable());
    }

    private MaintenanceResult runMaintenance(LocalDateTime beginTime, String schema, String owner,
                                             Granularity granularity, boolean createParentTable) {
        String lockKey = schema + "." + SampleTableMetadata.TABLE_NAME;
        long startTime = System.currentTimeMillis();
        logger.info("Starting {} partition maintenance for {} from {}", granularity.getPlan(), lockKey, beginTime);

        try (MaintenanceLock lock = connectionProvider.acquireMaintenanceLock(lockKey,
                "update " + granularity.getPlan() + " partitions")) {
            rejectForeignGranularity(schema, granularity);
            if (createParentTable) {
                schemaInitializer.ensureParentTable(schema);
            }

            SynchronizationResult synchronization = synchronizer.synchronize(beginTime, schema, owner, granularity);

            Set<Bucket> routed = new TreeSet<>(catalog.listBuckets(schema, granularity));
            routed.addAll(synchronization.getBuckets());
            RoutineInstallResult routine = routerCompiler.rebuildDispatch(schema, routed);

            MaintenanceResult result = new MaintenanceResult(schema, granularity, synchronization, routine,
                System.currentTimeMillis() - startTime);
            logger.info("Partition maintenance completed: {}", result);
            return result;
        } catch (SQLException e) {
            logger.error("Partition maintenance failed for {}", lockKey, e);
            throw new PartitionMaintenanceException("Partition maintenance failed for " + lockKey, e);
        } catch (PartitionMaintenanceException e) {
            logger.error("Partition maintenance failed for {}: {}", lockKey, e.getMessage());
            throw e;
        }
    }

    /**
     * A parent table holds buckets of a single width; buckets of another width
     * would overlap the existing ones and drop them out of routing.
     */
    private void rejectForeignGranularity(String schema, Granularity granularity) throws SQLException {
        for (Granularity other : Granularity.values()) {
            if (other == granularity) {
                continue;
            }
            List<Bucket> foreign = catalog.listBuckets(schema, other);
            if (!foreign.isEmpty()) {
                throw new ConfigurationException(String.format(
                    "%s.%s is partitioned by %s (%s), cannot maintain %s buckets",
                    schema, SampleTableMetadata.TABLE_NAME, other.getPlan(), foreign.get(0).getName(),
                    granularity.getPlan()));
            }
        }
    }

    /**
     * Application-side routing table over every physical bucket of the granularity.
     */
    public DispatchTable loadDispatchTable(String schema, Granularity granularity) {
        try {
            return DispatchTable.of(schema, catalog.listBuckets(schema, granularity));
        } catch (SQLException e) {
            throw new PartitionMaintenanceException("Failed to list buckets of " + schema + ".sample", e);
        }
    }
}
