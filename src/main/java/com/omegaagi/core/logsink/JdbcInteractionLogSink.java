package com.omegaagi.core.logsink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link LogSink} that stores interactions in the {@code query_logs} table.
 * <p>
 * Inserts run on a single background thread so a slow database never holds up
 * generation. A failed insert is logged as a warning and the record is dropped.
 * The table is created by {@link #createTable()}.
 */
public class JdbcInteractionLogSink implements LogSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcInteractionLogSink.class);

    static final String TABLE_NAME = "query_logs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         VARCHAR(36) PRIMARY KEY,
                prompt     TEXT NOT NULL,
                response   TEXT NOT NULL,
                model      VARCHAR(255) NOT NULL,
                created_at TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, prompt, response, model, created_at)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT id, prompt, response, model, created_at
            FROM %s
            ORDER BY created_at DESC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ExecutorService writer;

    public JdbcInteractionLogSink(DataSource dataSource) {
        this.dataSource = dataSource;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "omega-logsink");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void createTable() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            log.info("Ensured {} table exists", TABLE_NAME);
        }
    }

    @Override
    public void record(String prompt, String response, String modelId, Instant timestamp) {
        var entry = new InteractionRecord(UUID.randomUUID().toString(),
                prompt == null ? "" : prompt,
                response == null ? "" : response,
                modelId == null ? "" : modelId,
                timestamp == null ? Instant.now() : timestamp);
        try {
            writer.execute(() -> insert(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Log sink is closed; dropping interaction record {}", entry.id());
        }
    }

    private void insert(InteractionRecord entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, entry.id());
            ps.setString(2, entry.prompt());
            ps.setString(3, entry.response());
            ps.setString(4, entry.model());
            ps.setTimestamp(5, Timestamp.from(entry.createdAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Failed to store interaction record {}: {}", entry.id(), e.getMessage());
        }
    }

    @Override
    public List<InteractionRecord> recent(int limit) {
        var records = new ArrayList<InteractionRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_RECENT_SQL)) {
            ps.setInt(1, Math.max(limit, 0));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new InteractionRecord(
                            rs.getString("id"),
                            rs.getString("prompt"),
                            rs.getString("response"),
                            rs.getString("model"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            log.warn("Failed to read interaction records: {}", e.getMessage());
        }
        return records;
    }

    /**
     * Stops accepting records and waits briefly for pending inserts to finish.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Log sink did not drain within 5s; pending records dropped");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
