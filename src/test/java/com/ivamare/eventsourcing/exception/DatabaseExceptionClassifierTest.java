package com.ivamare.eventsourcing.exception;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseExceptionClassifierTest {

    @Nested
    class SqlStateClassification {

        @Test
        void shouldClassifyConnectionStatesAsTransient() {
            assertTrue(isTransient("08001", "unable to establish"));
            assertTrue(isTransient("08006", "failure"));
            assertTrue(isTransient("08P01", "protocol violation"));
        }

        @Test
        void shouldClassifyResourceAndShutdownStatesAsTransient() {
            assertTrue(isTransient("53300", "too many clients"));
            assertTrue(isTransient("57P01", "admin shutdown"));
        }

        @Test
        void shouldClassifySerializationFailuresAsTransient() {
            assertTrue(isTransient("40001", "could not serialize access"));
            assertTrue(isTransient("40P01", "deadlock detected"));
        }

        @Test
        void shouldNotClassifyDataErrorsAsTransient() {
            assertFalse(isTransient("42601", "syntax error"));
            assertFalse(isTransient("23505", "unique violation"));
            assertFalse(isTransient(null, "no state"));
        }

        private boolean isTransient(String sqlState, String message) {
            return DatabaseExceptionClassifier.isTransient(new SQLException(message, sqlState));
        }
    }

    @Nested
    class SpringExceptionClassification {

        @Test
        void shouldClassifyConnectionFailuresAsTransient() {
            assertTrue(DatabaseExceptionClassifier.isTransient(
                new CannotGetJdbcConnectionException("no connection")));
            assertTrue(DatabaseExceptionClassifier.isTransient(
                new DataAccessResourceFailureException("resource failure")));
            assertTrue(DatabaseExceptionClassifier.isTransient(
                new QueryTimeoutException("query timeout")));
        }

        @Test
        void shouldNotClassifyIntegrityViolationsAsTransient() {
            assertFalse(DatabaseExceptionClassifier.isTransient(new DuplicateKeyException("duplicate")));
            assertFalse(DatabaseExceptionClassifier.isTransient(
                new DataIntegrityViolationException("constraint")));
        }
    }

    @Nested
    class CauseChainAndMessages {

        @Test
        void shouldFindTransientCauseInChain() {
            RuntimeException wrapped = new RuntimeException("outer",
                new IllegalStateException("middle", new SQLTransientConnectionException("inner")));

            assertTrue(DatabaseExceptionClassifier.isTransient(wrapped));
            assertEquals("JDBC SQLTransientConnectionException",
                DatabaseExceptionClassifier.getTransientReason(wrapped));
        }

        @Test
        void shouldClassifyRecoverableJdbcException() {
            assertTrue(DatabaseExceptionClassifier.isTransient(new SQLRecoverableException("recoverable")));
        }

        @Test
        void shouldMatchKnownMessagePatterns() {
            RuntimeException ex = new RuntimeException("Connection refused by host");

            assertTrue(DatabaseExceptionClassifier.isTransient(ex));
            assertEquals("Message pattern: connection refused", DatabaseExceptionClassifier.getTransientReason(ex));
        }

        @Test
        void shouldReportNonTransient() {
            IllegalArgumentException ex = new IllegalArgumentException("bad input");

            assertFalse(DatabaseExceptionClassifier.isTransient(ex));
            assertEquals("non-transient", DatabaseExceptionClassifier.getTransientReason(ex));
        }

        @Test
        void shouldHandleNull() {
            assertFalse(DatabaseExceptionClassifier.isTransient(null));
        }
    }
}
