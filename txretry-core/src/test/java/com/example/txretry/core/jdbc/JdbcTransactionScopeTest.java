package com.example.txretry.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class JdbcTransactionScopeTest {

  private Connection conn;
  private Savepoint savepoint;

  @BeforeEach
  void setUp() throws SQLException {
    conn = mock(Connection.class);
    savepoint = mock(Savepoint.class);
    when(conn.getAutoCommit()).thenReturn(true);
    when(conn.setSavepoint(DataSourceScopeFactory.COCKROACH_RESTART)).thenReturn(savepoint);
  }

  @Nested
  @DisplayName("Plain transactions")
  class Plain {

    @Test
    @DisplayName("Should begin a serializable transaction")
    void shouldBeginSerializable() throws SQLException {
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_SERIALIZABLE, null);

      scope.begin();

      final var inOrder = inOrder(conn);
      inOrder.verify(conn).setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
      inOrder.verify(conn).setAutoCommit(false);
      verify(conn, never()).setSavepoint(anyString());
      assertFalse(scope.supportsRestart());
    }

    @Test
    @DisplayName("Should keep the driver isolation level when none is requested")
    void shouldSkipIsolationForNone() throws SQLException {
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_NONE, null);

      scope.begin();

      verify(conn, never()).setTransactionIsolation(anyInt());
    }

    @Test
    @DisplayName("Should restore auto-commit and close after commit")
    void shouldRestoreAutoCommitOnClose() throws SQLException {
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_SERIALIZABLE, null);

      scope.begin();
      scope.commit();
      scope.rollback();
      scope.close();

      final var inOrder = inOrder(conn);
      inOrder.verify(conn).commit();
      inOrder.verify(conn).setAutoCommit(true);
      inOrder.verify(conn).close();
      verify(conn, never()).rollback();
    }

    @Test
    @DisplayName("Should not restore auto-commit over a transaction that failed to roll back")
    void shouldNotCommitImplicitlyAfterFailedRollback() throws SQLException {
      doThrow(new SQLException("connection reset", "08006")).when(conn).rollback();
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_SERIALIZABLE, null);

      scope.begin();
      assertThrows(SQLException.class, scope::rollback);
      scope.close();

      verify(conn, never()).setAutoCommit(true);
      verify(conn).close();
    }

    @Test
    @DisplayName("Should refuse restart without a savepoint")
    void shouldRefuseRestart() throws SQLException {
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_SERIALIZABLE, null);
      scope.begin();

      assertThrows(SQLFeatureNotSupportedException.class, scope::restart);
    }

    @Test
    @DisplayName("Should skip rollback on a closed connection")
    void shouldSkipRollbackWhenClosed() throws SQLException {
      final var scope = new JdbcTransactionScope(conn, Connection.TRANSACTION_SERIALIZABLE, null);
      scope.begin();
      when(conn.isClosed()).thenReturn(true);

      scope.rollback();
      scope.close();

      verify(conn, never()).rollback();
      verify(conn).close();
    }
  }

  @Nested
  @DisplayName("Savepoint restart")
  class SavepointRestart {

    @Test
    @DisplayName("Should set the restart savepoint right after begin")
    void shouldSetSavepoint() throws SQLException {
      final var scope =
          new JdbcTransactionScope(
              conn, Connection.TRANSACTION_SERIALIZABLE, DataSourceScopeFactory.COCKROACH_RESTART);

      scope.begin();

      final var inOrder = inOrder(conn);
      inOrder.verify(conn).setAutoCommit(false);
      inOrder.verify(conn).setSavepoint(DataSourceScopeFactory.COCKROACH_RESTART);
      assertTrue(scope.supportsRestart());
    }

    @Test
    @DisplayName("Should roll back to the savepoint on restart")
    void shouldRollbackToSavepoint() throws SQLException {
      final var scope =
          new JdbcTransactionScope(
              conn, Connection.TRANSACTION_SERIALIZABLE, DataSourceScopeFactory.COCKROACH_RESTART);
      scope.begin();

      scope.restart();
      scope.restart();

      verify(conn, times(2)).rollback(savepoint);
      verify(conn, never()).rollback();
    }

    @Test
    @DisplayName("Should release the savepoint before committing")
    void shouldReleaseBeforeCommit() throws SQLException {
      final var scope =
          new JdbcTransactionScope(
              conn, Connection.TRANSACTION_SERIALIZABLE, DataSourceScopeFactory.COCKROACH_RESTART);
      scope.begin();

      scope.commit();

      final var inOrder = inOrder(conn);
      inOrder.verify(conn).releaseSavepoint(savepoint);
      inOrder.verify(conn).commit();
    }
  }

  @Test
  @DisplayName("Should reject blank savepoint names")
  void shouldRejectBlankSavepointName() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DataSourceScopeFactory(mock(DataSource.class), 0, " "));
  }
}
