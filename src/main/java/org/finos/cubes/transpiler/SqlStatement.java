package org.finos.cubes.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with positional {@code ?} parameters and the values bound to them,
 * in order.
 *
 * @param sql        The SQL text
 * @param parameters The parameter values; may contain nulls
 */
public record SqlStatement(String sql, List<Object> parameters) {

    public SqlStatement {
        Objects.requireNonNull(sql, "SQL cannot be null");
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
