package com.omegaagi.core.health;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.llm.TextGenerationBackend;
import com.omegaagi.core.logsink.LogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String UNSET_API_KEY = "not-set";

    private final TextGenerationBackend backend;
    private final LogSink logSink;
    private final DataSource dataSource;
    private final OmegaProperties properties;
    private final String apiKey;

    public HealthCheckService(
            @Autowired(required = false) TextGenerationBackend backend,
            @Autowired(required = false) LogSink logSink,
            @Autowired(required = false) DataSource dataSource,
            OmegaProperties properties,
            @Value("${spring.ai.openai.api-key:" + UNSET_API_KEY + "}") String apiKey) {
        this.backend = backend;
        this.logSink = logSink;
        this.dataSource = dataSource;
        this.properties = properties;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBackend());
        results.add(checkLogSink());
        results.add(checkDatabase());
        return results;
    }

    private HealthStatus checkBackend() {
        if (backend == null) {
            return HealthStatus.down("backend", "No text generation backend configured");
        }
        var metadata = Map.of("defaultModel", properties.getDefaultModel());
        if (apiKey == null || apiKey.isBlank() || UNSET_API_KEY.equals(apiKey)) {
            return HealthStatus.degraded("backend",
                    "Backend configured without an API key", metadata);
        }
        return HealthStatus.up("backend",
                "Backend available (" + backend.getClass().getSimpleName() + ")", metadata);
    }

    private HealthStatus checkLogSink() {
        if (logSink == null) {
            return HealthStatus.degraded("logsink", "No log sink configured");
        }
        return HealthStatus.up("logsink", logSink.getClass().getSimpleName());
    }

    /**
     * The database is optional; without one interactions are only logged, so its absence degrades.
     */
    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.degraded("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid");
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database",
                    "Database error: " + e.getClass().getSimpleName());
        }
    }
}
