package com.telcobright.archive.db.maintenance;

import com.telcobright.archive.core.partition.Bucket;
import com.telcobright.archive.core.routing.DispatchRoutine;
import com.telcobright.archive.core.routing.DispatchStrategy;
import com.telcobright.archive.core.routing.DispatchTable;
import com.telcobright.archive.core.sql.postgresql.DispatchRoutineGenerator;
import com.telcobright.archive.db.catalog.PartitionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Optional;

/**
 * Regenerates the dispatch routine from scratch for a bucket set and
 * installs it under its fixed name, together with the insert hook the
 * first time.
 *
 * The routine's comment carries a hash of its source, so a run whose
 * bucket set did not change leaves the store untouched.
 */
public class RouterCompiler {

    private static final Logger logger = LoggerFactory.getLogger(RouterCompiler.class);

    private final PartitionCatalog catalog;
    private final DispatchRoutineGenerator generator;
    private final DispatchStrategy strategy;

    public RouterCompiler(PartitionCatalog catalog, DispatchRoutineGenerator generator, DispatchStrategy strategy) {
        this.catalog = catalog;
        this.generator = generator;
        this.strategy = strategy;
    }

    /**
     * @param buckets every bucket the routine must route to, in any order
     */
    public RoutineInstallResult rebuildDispatch(String schema, Collection<Bucket> buckets) throws SQLException {
        DispatchTable table = DispatchTable.of(schema, buckets);
        DispatchRoutine routine = generator.generate(table, strategy);

        Optional<String> installed = catalog.installedRoutineComment(schema);
        if (installed.isPresent() && routine.matchesComment(installed.get()) && catalog.insertHookExists(schema)) {
            logger.info("Dispatch routine for {} already current ({} buckets, {})",
                schema, table.size(), routine.getHash().substring(0, 12));
            return RoutineInstallResult.unchanged(routine);
        }

        boolean hookInstalled = catalog.replaceRoutine(schema, routine);
        logger.info("Replaced dispatch routine for {} with {} buckets ({} strategy, {})",
            schema, table.size(), strategy, routine.getHash().substring(0, 12));
        if (hookInstalled) {
            logger.info("Installed insert hook on {}.sample", schema);
        }
        return RoutineInstallResult.replaced(routine, hookInstalled);
    }
}
