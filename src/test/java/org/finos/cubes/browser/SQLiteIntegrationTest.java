package org.finos.cubes.browser;

import org.finos.cubes.execution.ExecutionContext;
import org.finos.cubes.transpiler.SQLDialect;
import org.finos.cubes.transpiler.SQLiteDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Browser integration tests on an in-memory SQLite database, with a
 * statement timeout.
 */
@DisplayName("SQLite Integration Tests")
class SQLiteIntegrationTest extends AbstractDatabaseTest {

    @Override
    protected SQLDialect getDialect() {
        return SQLiteDialect.INSTANCE;
    }

    @Override
    protected String getJdbcUrl() {
        return "jdbc:sqlite::memory:"; // In-memory SQLite
    }

    @Override
    protected ExecutionContext getExecutionContext() {
        return ExecutionContext.withTimeout(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("Queries run within the statement timeout")
    void testTimeout() {
        assertEquals(Duration.ofMillis(1500), getExecutionContext().findTimeout().orElseThrow());
        assertEquals(7, browser.fullCube().aggregate(null).summary().recordCount());
    }
}
