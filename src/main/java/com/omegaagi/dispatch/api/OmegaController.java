package com.omegaagi.dispatch.api;

import com.omegaagi.core.engine.OmegaInterpreter;
import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.reflection.ScriptReflector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for script execution, validation and repair.
 */
@RestController
@RequestMapping("/api/v1/omega")
public class OmegaController {

    private static final Logger log = LoggerFactory.getLogger(OmegaController.class);

    private final OmegaInterpreter interpreter;
    private final ScriptReflector reflector;

    public OmegaController(OmegaInterpreter interpreter, ScriptReflector reflector) {
        this.interpreter = interpreter;
        this.reflector = reflector;
    }

    /**
     * POST /api/v1/omega/execute: Run a script and return the assembled text.
     */
    @PostMapping("/execute")
    public ResponseEntity<?> execute(@RequestBody OmegaRequest request) {
        if (ApiErrors.isBlank(request.omega())) {
            return ApiErrors.badRequest("Script text is required");
        }
        try {
            var result = interpreter.execute(request.omega(), request.model());
            return ResponseEntity.ok(new ExecutionResponse(result.text(), result.warnings()));
        } catch (OmegaException e) {
            log.info("Execute request failed with {}", e.kind().displayName());
            return ApiErrors.from(e);
        }
    }

    /**
     * POST /api/v1/omega/validate: Check a script without calling the backend.
     */
    @PostMapping("/validate")
    public ResponseEntity<?> validate(@RequestBody OmegaRequest request) {
        if (request.omega() == null) {
            return ApiErrors.badRequest("Script text is required");
        }
        return ResponseEntity.ok(ValidationResponse.from(interpreter.validate(request.omega())));
    }

    /**
     * POST /api/v1/omega/correct: Repair an invalid script.
     */
    @PostMapping("/correct")
    public ResponseEntity<?> correct(@RequestBody OmegaRequest request) {
        if (ApiErrors.isBlank(request.omega())) {
            return ApiErrors.badRequest("Script text is required");
        }
        try {
            var result = interpreter.correct(request.omega(), request.model());
            return ResponseEntity.ok(new CorrectionResponse(result.correctedScript(), result.attempts()));
        } catch (OmegaException e) {
            log.info("Correct request failed with {}", e.kind().displayName());
            return ApiErrors.from(e);
        }
    }

    /**
     * POST /api/v1/omega/reflect: Score a script's structure and suggest improvements.
     */
    @PostMapping("/reflect")
    public ResponseEntity<?> reflect(@RequestBody OmegaRequest request) {
        if (ApiErrors.isBlank(request.omega())) {
            return ApiErrors.badRequest("Script text is required");
        }
        try {
            var report = reflector.reflect(request.omega(), request.model());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("score", report.score());
            body.put("recommendations", report.recommendations());
            body.put("feedback", report.rawFeedback());
            return ResponseEntity.ok(body);
        } catch (OmegaException e) {
            return ApiErrors.from(e);
        }
    }

    /**
     * POST /api/v1/omega/improve: Rewrite a script from feedback.
     */
    @PostMapping("/improve")
    public ResponseEntity<?> improve(@RequestBody ImproveRequest request) {
        if (ApiErrors.isBlank(request.omega())) {
            return ApiErrors.badRequest("Script text is required");
        }
        if (request.score() != null && (request.score() < 1 || request.score() > 100)) {
            return ApiErrors.badRequest("Score must be within 1..100");
        }
        try {
            String improved = reflector.improve(request.omega(), request.feedback(), request.score(), request.model());
            return ResponseEntity.ok(Map.of("omega", improved));
        } catch (OmegaException e) {
            return ApiErrors.from(e);
        }
    }
}
