/**
 * Transactional retry executor for serializable SQL stores.
 *
 * <p>Provides components for:
 *
 * <ul>
 *   <li>Classifying storage failures as retryable or fatal
 *   <li>Exponential backoff with jitter
 *   <li>Running units of work in transactions with bounded, cancellable retries
 *   <li>JDBC and R2DBC bindings, including CockroachDB's savepoint restart protocol
 *   <li>JSON and system-property retry configuration
 * </ul>
 */
module com.example.txretry.core {
  requires com.fasterxml.jackson.annotation;
  requires com.fasterxml.jackson.databind;
  requires java.sql;
  requires org.reactivestreams;
  requires r2dbc.spi;
  requires reactor.core;

  exports com.example.txretry.core;
  exports com.example.txretry.core.config;
  exports com.example.txretry.core.jdbc;
  exports com.example.txretry.core.reactive;

  opens com.example.txretry.core.config to
      com.fasterxml.jackson.databind;
}
