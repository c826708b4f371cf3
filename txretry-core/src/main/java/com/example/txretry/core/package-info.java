/**
 * Root package of the txretry library.
 *
 * <p>Everything needed to run a unit of work in a transaction and replay it when a serializable
 * store reports a transient conflict:
 *
 * <ul>
 *   <li>{@link com.example.txretry.core.RetryExecutor} – drives attempts until commit, fatal
 *       failure, cancellation or budget exhaustion.
 *   <li>{@link com.example.txretry.core.ErrorClassifier} and {@link
 *       com.example.txretry.core.SqlStateErrorClassifier} – decide which failures are retried.
 *   <li>{@link com.example.txretry.core.BackoffPolicy} and {@link
 *       com.example.txretry.core.ExponentialBackoff} – pace the attempts.
 *   <li>{@link com.example.txretry.core.RetryBudget} – attempt, time and backoff limits.
 *   <li>{@link com.example.txretry.core.TransactionScope} – the transaction contract implemented
 *       by the storage layer, see {@link com.example.txretry.core.jdbc.JdbcTransactionScope}.
 *   <li>{@link com.example.txretry.core.TransactionFailedException} and its subclasses – terminal
 *       failures, carrying every {@link com.example.txretry.core.AttemptRecord}.
 * </ul>
 */
package com.example.txretry.core;
