package org.finos.cubes.execution;

import org.finos.cubes.plan.RelationNode;

import java.util.List;

/**
 * Executes compiled plans against a backing store.
 *
 * Implementations must report failures as
 * {@link org.finos.cubes.QueryExecutionException} carrying the failing
 * statement, and must not retry.
 */
public interface DataStore {

    /**
     * Executes a plan and materializes its rows.
     *
     * @param plan    The compiled plan
     * @param context Timeout and cancellation of this execution
     * @return The rows, in result order
     */
    List<Row> execute(RelationNode plan, ExecutionContext context);
}
