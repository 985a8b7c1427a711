package org.finos.cubes.query;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.plan.AggregateExpression.AggregateFunction;

import java.util.Locale;

/**
 * Aggregation operators applicable to a measure.
 *
 * The operator name is the suffix of the generated field: {@code amount_sum},
 * {@code amount_average}.
 */
public enum Aggregation {
    SUM("sum", AggregateFunction.SUM),
    COUNT("count", AggregateFunction.COUNT),
    AVERAGE("average", AggregateFunction.AVG),
    MIN("min", AggregateFunction.MIN),
    MAX("max", AggregateFunction.MAX);

    private final String operatorName;
    private final AggregateFunction function;

    Aggregation(String operatorName, AggregateFunction function) {
        this.operatorName = operatorName;
        this.function = function;
    }

    /**
     * @return The lower case operator name (e.g., "average")
     */
    public String operatorName() {
        return operatorName;
    }

    public AggregateFunction function() {
        return function;
    }

    /**
     * Looks up an operator by name, ignoring case.
     *
     * @throws ConfigurationException if there is no such operator
     */
    public static Aggregation fromName(String name) {
        if (name != null) {
            String normalized = name.toLowerCase(Locale.ROOT);
            for (Aggregation aggregation : values()) {
                if (aggregation.operatorName.equals(normalized)) {
                    return aggregation;
                }
            }
        }
        throw new ConfigurationException("Unknown aggregation operator '" + name + "'");
    }
}
