package io.pricedock.orchestrator;

import java.sql.Connection;

/**
 * The business import. Runs inside a transaction the orchestrator commits on normal return
 * and rolls back when this throws. Must not touch {@code import_runs}.
 */
@FunctionalInterface
public interface ImportFunction {
    ImportPayload importFile(Connection connection, ImportContext context) throws Exception;
}
