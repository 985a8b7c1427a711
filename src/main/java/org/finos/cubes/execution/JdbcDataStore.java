package org.finos.cubes.execution;

import org.finos.cubes.QueryExecutionException;
import org.finos.cubes.plan.RelationNode;
import org.finos.cubes.transpiler.SQLDialect;
import org.finos.cubes.transpiler.SQLGenerator;
import org.finos.cubes.transpiler.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A {@link DataStore} over a JDBC connection.
 *
 * Plans are rendered as parameterized statements for the connection's
 * dialect. The connection is owned by the caller and is not closed here.
 *
 * Cancellation is checked before the statement is prepared and again once it
 * has run, before any row is read. A statement already running on the
 * database is bounded only by the context's timeout.
 */
public final class JdbcDataStore implements DataStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcDataStore.class);

    private final Connection connection;
    private final SQLGenerator generator;

    public JdbcDataStore(Connection connection, SQLDialect dialect) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.generator = new SQLGenerator(dialect);
    }

    public SQLDialect dialect() {
        return generator.dialect();
    }

    @Override
    public List<Row> execute(RelationNode plan, ExecutionContext context) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(context, "Execution context cannot be null");

        SqlStatement statement = generator.generateStatement(plan);
        if (context.isCancelled()) {
            throw new QueryExecutionException("Execution cancelled", statement.sql());
        }
        logger.debug("Executing {} with parameters {}", statement.sql(), statement.parameters());

        try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            List<Object> parameters = statement.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                ps.setObject(i + 1, parameters.get(i));
            }
            if (context.timeout() != null) {
                applyTimeout(ps, context.timeout());
            }
            try (ResultSet rs = ps.executeQuery()) {
                if (context.isCancelled()) {
                    throw new QueryExecutionException("Execution cancelled", statement.sql());
                }
                List<Row> rows = Row.fromResultSet(rs);
                logger.debug("Statement returned {} rows", rows.size());
                return rows;
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(e.getMessage(), statement.sql(), e);
        }
    }

    private void applyTimeout(PreparedStatement ps, Duration timeout) throws SQLException {
        int seconds = (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
        try {
            ps.setQueryTimeout(seconds);
        } catch (SQLFeatureNotSupportedException e) {
            logger.warn("{} does not support query timeouts, running without one", dialect().name());
        }
    }
}
