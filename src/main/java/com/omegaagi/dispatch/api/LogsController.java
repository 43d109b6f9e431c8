package com.omegaagi.dispatch.api;

import com.omegaagi.core.logsink.InteractionRecord;
import com.omegaagi.core.logsink.LogSink;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing recently stored backend interactions.
 */
@RestController
@RequestMapping("/api/v1/logs")
public class LogsController {

    static final int MAX_LIMIT = 500;

    private final LogSink logSink;

    public LogsController(LogSink logSink) {
        this.logSink = logSink;
    }

    /**
     * GET /api/v1/logs?limit=N: Most recent interactions first. Empty when no database is configured.
     */
    @GetMapping
    public ResponseEntity<List<InteractionRecord>> recent(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return ResponseEntity.ok(logSink.recent(bounded));
    }
}
