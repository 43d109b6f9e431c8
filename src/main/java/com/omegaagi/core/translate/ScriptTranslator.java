package com.omegaagi.core.translate;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.llm.OmegaPrompts;
import com.omegaagi.core.llm.ResponseText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Converts between natural-language instructions and Omega scripts.
 */
@Service
public class ScriptTranslator {

    private static final Logger log = LoggerFactory.getLogger(ScriptTranslator.class);

    private final LlmService llmService;
    private final OmegaProperties properties;

    public ScriptTranslator(LlmService llmService, OmegaProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    /**
     * Writes an Omega script for the given instructions. The result is not validated.
     */
    public String humanToOmega(String instructions, String modelHint) {
        requireText(instructions, "instructions");
        String prompt = OmegaPrompts.EXPERT_ROLE
                + " Convert the natural-language instructions below into a valid Omega script following best practices.\n\n"
                + OmegaPrompts.SYNTAX_GUIDE
                + "\nInstructions:\n" + instructions + "\n\n"
                + OmegaPrompts.SCRIPT_ONLY;
        String script = ResponseText.stripCodeFence(llmService.call(CallPurpose.HUMAN_TO_OMEGA, "instructions",
                prompt, properties.resolveModel(modelHint), properties.getHumanToOmegaTemperature()));
        log.info("Translated {} chars of instructions into a {} char script", instructions.length(), script.length());
        return script;
    }

    /**
     * Explains a script in plain language.
     */
    public String omegaToHuman(String script, String modelHint) {
        requireText(script, "script");
        String prompt = OmegaPrompts.EXPERT_ROLE
                + " Translate the following Omega script into plain, natural language.\n\n"
                + "Script:\n" + script;
        return llmService.call(CallPurpose.OMEGA_TO_HUMAN, "script", prompt,
                properties.resolveModel(modelHint), properties.getOmegaToHumanTemperature()).trim();
    }

    private static void requireText(String text, String what) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("No " + what + " given");
        }
    }
}
