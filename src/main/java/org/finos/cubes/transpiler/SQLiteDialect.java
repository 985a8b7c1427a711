package org.finos.cubes.transpiler;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * SQL dialect implementation for SQLite.
 * SQLite has no boolean or date types: booleans are 1/0 and dates are ISO
 * strings.
 */
public final class SQLiteDialect implements SQLDialect {

    public static final SQLiteDialect INSTANCE = new SQLiteDialect();

    private SQLiteDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "SQLite";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "1" : "0";
    }

    @Override
    public String formatDate(LocalDate value) {
        return quoteStringLiteral(value.toString());
    }

    @Override
    public Object bindValue(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        return value;
    }
}
