package com.ivamare.eventsourcing.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies storage exceptions raised inside the outbox loop as transient or not.
 *
 * <p>Transient failures (lost connections, pool exhaustion, serialization failures,
 * a restarting server) make the outbox back off and try again; anything else is
 * logged as an error but still backs off so the loop never spins.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
    }

    // 08 connection, 53 resources, 57 operator intervention, 40 rollback
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03",
        "40001", "40P01"
    );

    private static final List<String> TRANSIENT_MESSAGES = List.of(
        "connection refused",
        "connection reset",
        "timed out",
        "pool exhausted",
        "connection is not available",
        "connection closed",
        "broken pipe",
        "terminating connection",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * @param ex the exception to classify
     * @return true if the exception (or one of its causes) is transient
     */
    public static boolean isTransient(Throwable ex) {
        return classify(ex).isPresent();
    }

    /**
     * Short description of why the exception counts as transient, for log lines.
     *
     * @param ex the exception to describe
     * @return the reason, or "non-transient"
     */
    public static String getTransientReason(Throwable ex) {
        return classify(ex).orElse("non-transient");
    }

    private static Optional<String> classify(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 10) {
            Optional<String> reason = classifySingle(current);
            if (reason.isPresent()) {
                return reason;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    private static Optional<String> classifySingle(Throwable ex) {
        if (ex instanceof CannotGetJdbcConnectionException
                || ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return Optional.of("Spring " + ex.getClass().getSimpleName());
        }
        if (ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return Optional.of("JDBC " + ex.getClass().getSimpleName());
        }
        if (ex instanceof SQLException sqlEx) {
            String state = sqlEx.getSQLState();
            if (state != null && TRANSIENT_SQL_STATES.contains(state)) {
                return Optional.of("SQL state " + state);
            }
        }
        String message = ex.getMessage();
        if (message != null) {
            String lower = message.toLowerCase(Locale.ROOT);
            for (String pattern : TRANSIENT_MESSAGES) {
                if (lower.contains(pattern)) {
                    return Optional.of("Message pattern: " + pattern);
                }
            }
        }
        return Optional.empty();
    }
}
