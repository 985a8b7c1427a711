package org.finos.cubes;

import java.util.Objects;

/**
 * Exception thrown when the data store fails to execute a compiled statement.
 *
 * The adapter's original failure is kept as the cause and the failing
 * statement is available through {@link #statement()}.
 */
public class QueryExecutionException extends RuntimeException {

    private final String statement;

    public QueryExecutionException(String message, String statement) {
        super(message + ": " + statement);
        this.statement = Objects.requireNonNull(statement, "Statement cannot be null");
    }

    public QueryExecutionException(String message, String statement, Throwable cause) {
        super(message + ": " + statement, cause);
        this.statement = Objects.requireNonNull(statement, "Statement cannot be null");
    }

    /**
     * @return The SQL statement that failed
     */
    public String statement() {
        return statement;
    }
}
