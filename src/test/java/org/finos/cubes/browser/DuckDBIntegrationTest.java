package org.finos.cubes.browser;

import org.finos.cubes.transpiler.DuckDBDialect;
import org.finos.cubes.transpiler.SQLDialect;
import org.junit.jupiter.api.DisplayName;

/**
 * Browser integration tests on an in-memory DuckDB database.
 */
@DisplayName("DuckDB Integration Tests")
class DuckDBIntegrationTest extends AbstractDatabaseTest {

    @Override
    protected SQLDialect getDialect() {
        return DuckDBDialect.INSTANCE;
    }

    @Override
    protected String getJdbcUrl() {
        return "jdbc:duckdb:"; // In-memory DuckDB
    }
}
