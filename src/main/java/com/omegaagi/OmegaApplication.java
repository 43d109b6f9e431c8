package com.omegaagi;

import com.omegaagi.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for both faces of the interpreter: the {@code omega} command line,
 * which exits with the command's code, and {@code omega serve}, which keeps the
 * HTTP API running.
 */
@SpringBootApplication
public class OmegaApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        ConfigurableApplicationContext ctx = builder(serveMode).run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }

    static SpringApplicationBuilder builder(boolean serveMode) {
        return new SpringApplicationBuilder(OmegaApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off",
                        // script output goes to stdout; keep startup logging off it
                        "spring.main.log-startup-info=" + serveMode);
    }
}
