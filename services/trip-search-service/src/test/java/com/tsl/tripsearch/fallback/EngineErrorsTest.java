package com.tsl.tripsearch.fallback;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.UncategorizedSQLException;

class EngineErrorsTest {

    @Test
    void timeoutTypesAreComplexityErrors() {
        assertThat(EngineErrors.isComplexityError(new QueryTimeoutException("cancelled"))).isTrue();
        assertThat(EngineErrors.isComplexityError(new RuntimeException("wrapped", new SQLTimeoutException("x")))).isTrue();
    }

    @Test
    void engineMessagesAreMatchedThroughTheCauseChain() {
        SQLException cause = new SQLException("Query execution was interrupted, maximum statement execution time exceeded");
        assertThat(EngineErrors.isComplexityError(new UncategorizedSQLException("search", "SELECT 1", cause))).isTrue();
        assertThat(EngineErrors.isComplexityError(new IllegalStateException("The regular expression is too complex"))).isTrue();
    }

    @Test
    void otherFailuresAreNotComplexityErrors() {
        assertThat(EngineErrors.isComplexityError(new IllegalStateException("Unknown column 'x'"))).isFalse();
        assertThat(EngineErrors.isComplexityError(null)).isFalse();
    }
}
