package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.partition.BucketCalendar;
import com.telcobright.archive.core.partition.Granularity;
import com.telcobright.archive.db.catalog.PartitionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Makes sure a bucket table exists for every bucket from beginTime through
 * one bucket past the current time.
 *
 * Existing buckets are never altered or dropped, so running it again with
 * the same arguments creates nothing.
 */
public class PartitionCatalogSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(PartitionCatalogSynchronizer.class);

    private final PartitionCatalog catalog;
    private final Clock clock;

    public PartitionCatalogSynchronizer(PartitionCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    public SynchronizationResult synchronize(LocalDateTime beginTime, String schema, String owner,
                                             Granularity granularity) throws SQLException {
        Objects.requireNonNull(beginTime, "beginTime");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(granularity, "granularity");

        catalog.verifyPrerequisites(schema, owner);

        BucketCalendar calendar = new BucketCalendar(granularity, clock);
        List<Bucket> window = calendar.window(beginTime);
        logger.info("Synchronizing {} {} buckets in schema {} from {} to horizon {}",
            window.size(), granularity.getPlan(), schema, beginTime, calendar.horizon());

        List<Bucket> created = new ArrayList<>();
        for (Bucket bucket : window) {
            if (catalog.bucketExists(schema, bucket)) {
                logger.debug("Bucket exists: {}", bucket);
                continue;
            }
            catalog.createBucket(schema, owner, bucket);
            created.add(bucket);
            logger.info("Created bucket {}.{} for [{}, {})", schema, bucket.getName(), bucket.getStart(), bucket.getEnd());
        }

        return new SynchronizationResult(window, created);
    }
}
