package org.finos.cubes.browser;

import org.finos.cubes.execution.Row;

/**
 * A caller supplied field derived from each drill-down row.
 *
 * Computations must be pure: they see the row as returned by the store plus
 * the fields computed before them, and must not rely on call order across rows.
 */
@FunctionalInterface
public interface ComputedField {

    Object compute(Row row);
}
