package org.finos.cubes.plan;

import java.util.Objects;

/**
 * IR node for LIMIT and OFFSET operations.
 *
 * SQL: SELECT ... FROM ... LIMIT n OFFSET m
 *
 * Supports:
 * - limit(n) → LIMIT n
 * - page(p, s) → LIMIT s OFFSET p*s
 *
 * @param source The source relation
 * @param limit  Maximum number of rows (null = no limit, only without offset)
 * @param offset Number of rows to skip (0 = no offset)
 */
public record LimitNode(
        RelationNode source,
        Integer limit,
        long offset) implements RelationNode {

    public LimitNode {
        Objects.requireNonNull(source, "Source cannot be null");
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (limit == null && offset > 0) {
            // SQLite has no OFFSET without LIMIT
            throw new IllegalArgumentException("Offset requires a limit");
        }
    }

    /**
     * Creates a LIMIT-only node (no offset).
     */
    public static LimitNode limit(RelationNode source, int limit) {
        return new LimitNode(source, limit, 0);
    }

    /**
     * Creates a LIMIT+OFFSET node for a zero-based page of the given size.
     */
    public static LimitNode page(RelationNode source, int page, int pageSize) {
        return new LimitNode(source, pageSize, (long) page * pageSize);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "LimitNode(" + limit + " OFFSET " + offset + " <- " + source + ")";
    }
}
