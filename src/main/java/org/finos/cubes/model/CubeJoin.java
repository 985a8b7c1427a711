package org.finos.cubes.model;

import java.util.Objects;

/**
 * A join declared on a cube, from a fact field to a detail table field.
 *
 * Carried as model metadata; the query compiler works on a single denormalized
 * fact source and does not generate joins.
 *
 * @param master The fact side field (e.g., "product_id")
 * @param detail The detail side field (e.g., "dim_product.id")
 * @param alias  Optional alias of the detail table
 */
public record CubeJoin(
        String master,
        String detail,
        String alias) {

    public CubeJoin {
        Objects.requireNonNull(master, "Join master cannot be null");
        Objects.requireNonNull(detail, "Join detail cannot be null");
    }
}
