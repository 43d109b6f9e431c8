package com.omegaagi.core.logsink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link LogSink} bean.
 * <p>
 * When a {@link DataSource} is available, interactions are persisted to
 * {@code query_logs} through {@link JdbcInteractionLogSink}. Otherwise they only go to
 * the application log.
 */
@Configuration
public class LogSinkConfig {

    private static final Logger log = LoggerFactory.getLogger(LogSinkConfig.class);

    @Bean
    public LogSink logSink(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.info("No DataSource available; backend interactions are logged but not persisted");
            return new Slf4jLogSink();
        }
        log.info("Configuring JDBC interaction log sink");
        var sink = new JdbcInteractionLogSink(available);
        sink.createTable();
        return sink;
    }
}
