package io.sessionstore.postgres;

import io.sessionstore.core.SessionBackendException;
import io.sessionstore.core.SessionId;
import io.sessionstore.core.SessionIdCollisionException;
import io.sessionstore.server.spi.FieldWrite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;
import org.postgresql.util.ServerErrorMessage;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostgresSessionStoreTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;

    private PostgresSessionStore store;

    @BeforeEach
    void setUp() {
        store = PostgresSessionStore.builder(dataSource)
                .executor(Runnable::run)
                .cleanupInterval(Duration.ZERO)
                .build();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void primaryKeyViolationOnRenameIsCollision() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenThrow(uniqueViolation("sessions_pkey"));

        assertThatThrownBy(() -> store.setAndRename(SessionId.of("a"), SessionId.of("b"),
                FieldWrite.upsert("user", "x".getBytes(StandardCharsets.UTF_8), null)).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(SessionIdCollisionException.class, e -> {
                    assertThat(e.source()).isEqualTo(SessionId.of("a"));
                    assertThat(e.target()).isEqualTo(SessionId.of("b"));
                });
        verify(connection).close();
    }

    @Test
    void otherUniqueViolationIsBackendFailure() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenThrow(uniqueViolation("session_kv_pkey"));

        assertThatThrownBy(() -> store.rename(SessionId.of("a"), SessionId.of("b"), null).get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(SessionBackendException.class)
                .hasRootCauseInstanceOf(PSQLException.class);
    }

    @Test
    void connectionFailureIsBackendFailure() throws Exception {
        when(dataSource.getConnection()).thenThrow(new PSQLException("refused", PSQLState.CONNECTION_UNABLE_TO_CONNECT));

        assertThatThrownBy(() -> store.delete(SessionId.of("a")).get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(SessionBackendException.class)
                .hasMessage("PostgreSQL delete failed");
    }

    @Test
    void renameOntoItselfIsRejected() {
        assertThatThrownBy(() -> store.rename(SessionId.of("a"), SessionId.of("a"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveExpireDeletes() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenThrow(new SQLException("stop"));

        assertThatThrownBy(() -> store.expire(SessionId.of("a"), Duration.ofSeconds(-1)).get(5, TimeUnit.SECONDS))
                .hasMessageContaining("PostgreSQL delete failed");
        verify(connection).prepareStatement(new PostgresStatements(store.tables()).delete);
    }

    private static PSQLException uniqueViolation(String constraint) {
        return new PSQLException(new ServerErrorMessage(
                "SERROR\0C23505\0Mduplicate key value violates unique constraint\0n" + constraint + "\0"));
    }
}
