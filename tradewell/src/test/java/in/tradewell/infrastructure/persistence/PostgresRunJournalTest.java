package in.tradewell.infrastructure.persistence;

import in.tradewell.domain.session.SessionRunId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresRunJournalTest {

    private static final Instant NOW = Instant.parse("2024-03-04T21:00:05Z");
    private static final SessionRunId RUN = new SessionRunId("6f1c2d7e-run");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;

    private PostgresRunJournal journal;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        journal = new PostgresRunJournal(dataSource, "1.2.0", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recordStart_insertsRunRow() throws SQLException {
        when(connection.prepareStatement(PostgresRunJournal.INSERT_SQL)).thenReturn(statement);

        journal.recordStart(RUN, 4, 120, false);

        verify(statement).setString(1, "6f1c2d7e-run");
        verify(statement).setTimestamp(2, Timestamp.from(NOW));
        verify(statement).setInt(3, 4);
        verify(statement).setInt(4, 120);
        verify(statement).setBoolean(5, false);
        verify(statement).setString(6, "1.2.0");
        verify(statement).executeUpdate();
        verify(statement).close();
        verify(connection).close();
    }

    @Test
    void recordEnd_updatesEndTimeAndReason() throws SQLException {
        when(connection.prepareStatement(PostgresRunJournal.UPDATE_END_SQL)).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(1);

        journal.recordEnd(RUN, "interrupted");

        ArgumentCaptor<Timestamp> endedAt = ArgumentCaptor.forClass(Timestamp.class);
        verify(statement).setTimestamp(eq(1), endedAt.capture());
        assertEquals(NOW, endedAt.getValue().toInstant());
        verify(statement).setString(2, "interrupted");
        verify(statement).setString(3, "6f1c2d7e-run");
    }

    @Test
    void recordEnd_unknownRunIsNotAnError() throws SQLException {
        when(connection.prepareStatement(PostgresRunJournal.UPDATE_END_SQL)).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(0);

        assertDoesNotThrow(() -> journal.recordEnd(RUN, "completed"));
    }

    @Test
    void sqlFailureIsWrapped() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("connection reset"));

        RuntimeException error = assertThrows(RuntimeException.class, () -> journal.recordStart(RUN, 1, 1, true));

        assertInstanceOf(SQLException.class, error.getCause());
        verify(connection).close();
    }

    @Test
    void migrate_createsTable() throws SQLException {
        Statement ddl = mock(Statement.class);
        when(connection.createStatement()).thenReturn(ddl);

        journal.migrate();

        verify(ddl).execute(contains("CREATE TABLE IF NOT EXISTS session_runs"));
    }
}
