package com.chambua.schoolsports.exception;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Tells a unique-key violation on a named constraint apart from the other integrity failures
 * (foreign keys, not-null) that surface as the same {@link DataIntegrityViolationException}.
 */
public final class DuplicateKeys {

    private static final String UNIQUE_SQL_STATE = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private DuplicateKeys() {}

    public static boolean violates(DataIntegrityViolationException ex, String constraint) {
        String key = constraint.toLowerCase(Locale.ROOT);
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) t).getConstraintName();
                if (name != null && name.toLowerCase(Locale.ROOT).contains(key)) return true;
            }
            if (t instanceof SQLException) {
                SQLException sql = (SQLException) t;
                boolean unique = UNIQUE_SQL_STATE.equals(sql.getSQLState())
                        || sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY;
                if (unique && mentions(sql.getMessage(), key)) return true;
            }
            if (t instanceof DuplicateKeyException && mentions(t.getMessage(), key)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static boolean mentions(String message, String key) {
        return message != null && message.toLowerCase(Locale.ROOT).contains(key);
    }
}
