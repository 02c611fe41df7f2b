package com.scriptorium;

import com.scriptorium.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point for both the CLI and {@code scriptorium serve}. A leading
 * {@code --memory} runs either mode without PostgreSQL.
 */
@SpringBootApplication
public class ScriptoriumApplication {

    public static void main(String[] args) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        boolean inMemory = arguments.remove(CliRunner.MEMORY_FLAG);
        boolean serveMode = CliRunner.isServeInvocation(arguments);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(ScriptoriumApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off");
        if (inMemory) {
            builder.profiles("memory");
        }
        if (!serveMode) {
            // keep command output free of startup logging
            builder.properties("spring.main.log-startup-info=false");
        }

        ApplicationContext ctx = builder.run(arguments.toArray(String[]::new));

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }
}
