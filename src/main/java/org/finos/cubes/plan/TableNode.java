package org.finos.cubes.plan;

import org.finos.cubes.model.FactSource;

import java.util.Objects;

/**
 * Represents a scan of a cube's fact source.
 * This corresponds to the FROM clause in SQL.
 *
 * @param source The fact table, view or SELECT statement
 * @param alias  The alias for SQL generation (e.g., "v")
 */
public record TableNode(
        FactSource source,
        String alias) implements RelationNode {

    public TableNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");

        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    /**
     * Creates a TableNode with the default fact alias.
     */
    public TableNode(FactSource source) {
        this(source, "v");
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "TableNode(" + source + " AS " + alias + ")";
    }
}
