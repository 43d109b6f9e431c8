package com.omegaagi.dispatch.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes script files for the CLI commands.
 */
final class ScriptFiles {

    private ScriptFiles() {}

    static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static void write(Path path, String script) throws IOException {
        Files.writeString(path, script, StandardCharsets.UTF_8);
    }
}
