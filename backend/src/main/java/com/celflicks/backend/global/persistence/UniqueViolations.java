package com.celflicks.backend.global.persistence;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

import org.hibernate.exception.ConstraintViolationException;

/**
 * Classifies persistence failures raised by PostgreSQL unique constraints.
 */
public final class UniqueViolations {

    /** PostgreSQL {@code unique_violation}. */
    public static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    public static final Set<String> USERNAME_CONSTRAINTS = Set.of(
            "uq_profile_username",
            "uq_profile_username_lower"
    );

    private UniqueViolations() {
    }

    public static boolean isUniqueViolation(Throwable failure) {
        return UNIQUE_VIOLATION_SQL_STATE.equals(findSqlState(failure));
    }

    /**
     * True for a unique violation on one of the profile username constraints. When the driver does not
     * report the constraint name the violation is assumed to be the username one.
     */
    public static boolean isUsernameViolation(Throwable failure) {
        if (!isUniqueViolation(failure)) {
            return false;
        }
        String constraint = findConstraintName(failure);
        return constraint == null || USERNAME_CONSTRAINTS.contains(constraint.toLowerCase(Locale.ROOT));
    }

    public static boolean isConstraintViolation(Throwable failure, String constraintName) {
        String constraint = findConstraintName(failure);
        return isUniqueViolation(failure) && constraint != null && constraint.equalsIgnoreCase(constraintName);
    }

    static String findSqlState(Throwable failure) {
        for (Throwable current = failure; current != null; current = nextCause(current)) {
            if (current instanceof ConstraintViolationException violation && violation.getSQLState() != null) {
                return violation.getSQLState();
            }
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
        }
        return null;
    }

    static String findConstraintName(Throwable failure) {
        for (Throwable current = failure; current != null; current = nextCause(current)) {
            if (current instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return violation.getConstraintName();
            }
        }
        return null;
    }

    private static Throwable nextCause(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
