package org.finos.cubes.transpiler;

import org.finos.cubes.model.FactSource;
import org.finos.cubes.plan.AggregateExpression;
import org.finos.cubes.plan.BetweenExpression;
import org.finos.cubes.plan.ColumnReference;
import org.finos.cubes.plan.ComparisonExpression;
import org.finos.cubes.plan.Conjunction;
import org.finos.cubes.plan.Expression;
import org.finos.cubes.plan.ExpressionVisitor;
import org.finos.cubes.plan.FilterNode;
import org.finos.cubes.plan.GroupByNode;
import org.finos.cubes.plan.LimitNode;
import org.finos.cubes.plan.Literal;
import org.finos.cubes.plan.ProjectNode;
import org.finos.cubes.plan.Projection;
import org.finos.cubes.plan.RelationNode;
import org.finos.cubes.plan.RelationNodeVisitor;
import org.finos.cubes.plan.SortNode;
import org.finos.cubes.plan.TableNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Transpiles a RelationNode tree into a SQL string.
 *
 * A chain of Limit over Sort over Project or GroupBy over Filters over a table
 * renders as one SELECT statement. Any other nesting turns the inner chain
 * into a derived table: a rank limit over a drill-down, for example, renders
 * as {@code SELECT * FROM (drill) AS "s" ORDER BY ... LIMIT n}.
 *
 * {@link #generate(RelationNode)} inlines literals as dialect-escaped text;
 * {@link #generateStatement(RelationNode)} replaces them with {@code ?}
 * parameters.
 */
public final class SQLGenerator implements RelationNodeVisitor<String>, ExpressionVisitor<String> {

    private static final String DERIVED_ALIAS = "s";

    private final SQLDialect dialect;
    private final List<Object> parameters;

    public SQLGenerator(SQLDialect dialect) {
        this(dialect, null);
    }

    private SQLGenerator(SQLDialect dialect, List<Object> parameters) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.parameters = parameters;
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Generates SQL from a relation node tree, with literals inlined.
     *
     * @param node The root node of the plan
     * @return The generated SQL string
     */
    public String generate(RelationNode node) {
        return node.accept(this);
    }

    /**
     * Generates a parameterized statement from a relation node tree.
     * Parameter values are converted with {@link SQLDialect#bindValue(Object)}.
     */
    public SqlStatement generateStatement(RelationNode node) {
        List<Object> bound = new ArrayList<>();
        SQLGenerator parameterized = new SQLGenerator(dialect, bound);
        String sql = node.accept(parameterized);
        return new SqlStatement(sql, bound);
    }

    /**
     * Generates SQL from an expression.
     *
     * @param expression The expression to generate SQL for
     * @return The generated SQL string
     */
    public String generateExpression(Expression expression) {
        return expression.accept(this);
    }

    // ==================== RelationNode Visitors ====================

    @Override
    public String visit(TableNode table) {
        return renderSelect(table);
    }

    @Override
    public String visit(FilterNode filter) {
        return renderSelect(filter);
    }

    @Override
    public String visit(ProjectNode project) {
        return renderSelect(project);
    }

    @Override
    public String visit(GroupByNode groupBy) {
        return renderSelect(groupBy);
    }

    @Override
    public String visit(SortNode sort) {
        return renderSelect(sort);
    }

    @Override
    public String visit(LimitNode limit) {
        return renderSelect(limit);
    }

    /**
     * Peels the clauses of one SELECT statement off the node chain, outermost
     * first, then renders them in SQL clause order so parameters line up.
     */
    private String renderSelect(RelationNode root) {
        RelationNode node = root;

        LimitNode limit = null;
        if (node instanceof LimitNode l) {
            limit = l;
            node = l.source();
        }
        SortNode sort = null;
        if (node instanceof SortNode s) {
            sort = s;
            node = s.source();
        }
        List<Projection> projections = null;
        List<Expression> grouping = List.of();
        if (node instanceof ProjectNode p) {
            projections = p.projections();
            node = p.source();
        } else if (node instanceof GroupByNode g) {
            projections = g.projections();
            grouping = g.groupingColumns();
            node = g.source();
        }
        List<Expression> conditions = new ArrayList<>();
        while (node instanceof FilterNode f) {
            conditions.add(0, f.condition());
            node = f.source();
        }

        var sb = new StringBuilder("SELECT ");
        sb.append(projections == null ? "*" : formatProjections(projections));
        sb.append(" FROM ");
        if (node instanceof TableNode table) {
            sb.append(formatSource(table.source()));
            sb.append(" AS ").append(dialect.quoteIdentifier(table.alias()));
        } else {
            sb.append("(").append(node.accept(this)).append(") AS ").append(dialect.quoteIdentifier(DERIVED_ALIAS));
        }
        if (!conditions.isEmpty()) {
            sb.append(" WHERE ");
            sb.append(Conjunction.allOf(conditions).accept(this));
        }
        if (!grouping.isEmpty()) {
            sb.append(" GROUP BY ");
            sb.append(grouping.stream().map(e -> e.accept(this)).collect(Collectors.joining(", ")));
        }
        if (sort != null) {
            sb.append(" ORDER BY ");
            sb.append(sort.columns().stream()
                    .map(col -> col.column().accept(this) + " " + col.direction().name())
                    .collect(Collectors.joining(", ")));
        }
        if (limit != null) {
            if (limit.limit() != null) {
                sb.append(" LIMIT ").append(limit.limit());
            }
            if (limit.offset() > 0) {
                sb.append(" OFFSET ").append(limit.offset());
            }
        }
        return sb.toString();
    }

    private String formatSource(FactSource source) {
        if (!source.isTable()) {
            return "(" + source.query() + ")";
        }
        if (!source.schema().isEmpty()) {
            return dialect.quoteIdentifier(source.schema()) + "." + dialect.quoteIdentifier(source.name());
        }
        return dialect.quoteIdentifier(source.name());
    }

    private String formatProjections(List<Projection> projections) {
        return projections.stream()
                .map(this::formatProjection)
                .collect(Collectors.joining(", "));
    }

    private String formatProjection(Projection projection) {
        String expr = projection.expression().accept(this);
        return expr + " AS " + dialect.quoteIdentifier(projection.alias());
    }

    // ==================== Expression Visitors ====================

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        return dialect.quoteIdentifier(columnRef.columnName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        if (literal.type() == Literal.Type.NULL) {
            return dialect.formatNull();
        }
        if (parameters != null) {
            parameters.add(dialect.bindValue(literal.value()));
            return "?";
        }
        return switch (literal.type()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DECIMAL -> ((BigDecimal) literal.value()).toPlainString();
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case DATE -> dialect.formatDate((LocalDate) literal.value());
            case NULL -> dialect.formatNull();
        };
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        String left = comparison.left().accept(this);
        String op = comparison.operator().toSql();

        if (comparison.operator().isUnary()) {
            return left + " " + op;
        }

        String right = comparison.right().accept(this);
        return left + " " + op + " " + right;
    }

    @Override
    public String visitBetween(BetweenExpression between) {
        return between.operand().accept(this)
                + " BETWEEN " + between.lower().accept(this)
                + " AND " + between.upper().accept(this);
    }

    @Override
    public String visitConjunction(Conjunction conjunction) {
        return conjunction.operands().stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        if (aggregate.function() == AggregateExpression.AggregateFunction.COUNT_ALL) {
            return "COUNT(*)";
        }
        return aggregate.function().sql() + "(" + aggregate.argument().accept(this) + ")";
    }
}
