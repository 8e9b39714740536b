package com.payment.checkout.persistence.store;

import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

/**
 * Reads PostgreSQL SQLSTATE codes out of whatever exception chain the driver and Spring produced.
 */
public final class SqlStateClassifier {

    public static final String UNDEFINED_COLUMN = "42703";
    public static final String UNIQUE_VIOLATION = "23505";

    private SqlStateClassifier() {}

    /** First SQLSTATE found walking the cause chain, or null. */
    public static String sqlState(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 16) {
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null) return state;
            }
            t = t.getCause();
        }
        return null;
    }

    public static boolean isUndefinedColumn(Throwable error) {
        return UNDEFINED_COLUMN.equals(sqlState(error));
    }

    public static boolean isUniqueViolation(Throwable error) {
        return error instanceof DuplicateKeyException || UNIQUE_VIOLATION.equals(sqlState(error));
    }
}
