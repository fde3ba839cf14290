package in.tradewell.infrastructure.persistence;

import in.tradewell.application.port.output.RunJournal;
import in.tradewell.domain.session.SessionRunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;

/**
 * PostgreSQL implementation of RunJournal.
 *
 * One row per run in {@code session_runs}; the end time and reason are
 * filled in when the run finishes.
 */
public final class PostgresRunJournal implements RunJournal {
    private static final Logger log = LoggerFactory.getLogger(PostgresRunJournal.class);

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS session_runs (
                run_id         VARCHAR(64) PRIMARY KEY,
                started_at     TIMESTAMPTZ NOT NULL,
                worker_count   INTEGER NOT NULL,
                universe_size  INTEGER NOT NULL,
                scanners_only  BOOLEAN NOT NULL,
                build_label    VARCHAR(128),
                ended_at       TIMESTAMPTZ,
                end_reason     TEXT
            )
            """;

    static final String INSERT_SQL = """
            INSERT INTO session_runs (
                run_id, started_at, worker_count, universe_size, scanners_only, build_label
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

    static final String UPDATE_END_SQL = """
            UPDATE session_runs
            SET ended_at = ?, end_reason = ?
            WHERE run_id = ?
            """;

    private final DataSource dataSource;
    private final String buildLabel;
    private final Clock clock;

    public PostgresRunJournal(DataSource dataSource, String buildLabel) {
        this(dataSource, buildLabel, Clock.systemUTC());
    }

    PostgresRunJournal(DataSource dataSource, String buildLabel, Clock clock) {
        this.dataSource = dataSource;
        this.buildLabel = buildLabel;
        this.clock = clock;
    }

    /**
     * Create the table if missing.
     */
    public void migrate() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(CREATE_TABLE_SQL);
            log.info("✓ session_runs table ready");
        } catch (SQLException e) {
            log.error("Failed to create session_runs table: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to migrate session_runs", e);
        }
    }

    @Override
    public void recordStart(SessionRunId runId, int workerCount, int universeSize, boolean scannersOnly) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {

            ps.setString(1, runId.value());
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            ps.setInt(3, workerCount);
            ps.setInt(4, universeSize);
            ps.setBoolean(5, scannersOnly);
            ps.setString(6, buildLabel);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to record start of run {}: {}", runId, e.getMessage(), e);
            throw new RuntimeException("Failed to record run start", e);
        }
    }

    @Override
    public void recordEnd(SessionRunId runId, String reason) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_END_SQL)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, reason);
            ps.setString(3, runId.value());
            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.warn("No session_runs row for run {}, end reason '{}' not stored", runId, reason);
            }

        } catch (SQLException e) {
            log.error("Failed to record end of run {}: {}", runId, e.getMessage(), e);
            throw new RuntimeException("Failed to record run end", e);
        }
    }
}
