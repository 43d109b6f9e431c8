package com.omegaagi.dispatch.api;

import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.translate.ScriptTranslator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller converting between natural language and Omega scripts.
 */
@RestController
@RequestMapping("/api/v1")
public class TranslationController {

    private final ScriptTranslator translator;

    public TranslationController(ScriptTranslator translator) {
        this.translator = translator;
    }

    /**
     * POST /api/v1/human-to-omega: Write a script for natural-language instructions.
     */
    @PostMapping("/human-to-omega")
    public ResponseEntity<?> humanToOmega(@RequestBody HumanToOmegaRequest request) {
        if (ApiErrors.isBlank(request.humanText())) {
            return ApiErrors.badRequest("human_text is required");
        }
        try {
            return ResponseEntity.ok(Map.of("omega", translator.humanToOmega(request.humanText(), request.model())));
        } catch (OmegaException e) {
            return ApiErrors.from(e);
        }
    }

    /**
     * POST /api/v1/omega-to-human: Explain a script in plain language.
     */
    @PostMapping("/omega-to-human")
    public ResponseEntity<?> omegaToHuman(@RequestBody OmegaRequest request) {
        if (ApiErrors.isBlank(request.omega())) {
            return ApiErrors.badRequest("Script text is required");
        }
        try {
            return ResponseEntity.ok(Map.of("human_text", translator.omegaToHuman(request.omega(), request.model())));
        } catch (OmegaException e) {
            return ApiErrors.from(e);
        }
    }
}
