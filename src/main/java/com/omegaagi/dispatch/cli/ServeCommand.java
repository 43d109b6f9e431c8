package com.omegaagi.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: omega serve
 * <p>
 * Runs the REST API. When {@link CliRunner#isServeMode} sees "serve" as the subcommand the
 * web server is enabled and picocli is skipped. The banner is printed once the server is up.
 * <p>
 * Configure the port via {@code SERVER_PORT=9090 omega serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Omega HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli (e.g. help); serve mode bypasses it.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Omega server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/omega");
        System.out.println("  Health:  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
