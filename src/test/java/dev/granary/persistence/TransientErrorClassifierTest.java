package dev.granary.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

class TransientErrorClassifierTest {

  @Test
  void transientTypesAreRecognized() {
    assertThat(TransientErrorClassifier.isTransient(new QueryTimeoutException("slow"))).isTrue();
    assertThat(TransientErrorClassifier.isTransient(new CannotGetJdbcConnectionException("down")))
        .isTrue();
    assertThat(TransientErrorClassifier.isTransient(new SQLTransientConnectionException("x")))
        .isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "HikariPool-1 - Connection is not available, request timed out after 30000ms",
        "FATAL: remaining connection slots are reserved for non-replication superuser connections",
        "ERROR: canceling statement due to lock timeout",
        "Unable to acquire JDBC Connection"
      })
  void signaturesAnywhereInCauseChainAreTransient(String message) {
    RuntimeException wrapped =
        new IllegalStateException("upsert failed", new RuntimeException(message));

    assertThat(TransientErrorClassifier.isTransient(wrapped)).isTrue();
  }

  @Test
  void constraintViolationsArePermanent() {
    assertThat(
            TransientErrorClassifier.isTransient(
                new DataIntegrityViolationException("duplicate key value violates unique")))
        .isFalse();
    assertThat(TransientErrorClassifier.isTransient(null)).isFalse();
  }

  @Test
  void persistenceFailureCarriesClassification() {
    PersistenceFailureException failure =
        PersistenceFailureException.classify("upsert", new QueryTimeoutException("slow"));

    assertThat(failure.getKind()).isEqualTo(PersistenceFailureException.Kind.TRANSIENT);
    assertThat(failure.getMessage()).startsWith("upsert failed (TRANSIENT)");
    assertThat(
            PersistenceFailureException.classify("upsert", new IllegalArgumentException("bad"))
                .getKind())
        .isEqualTo(PersistenceFailureException.Kind.PERMANENT);
  }
}
