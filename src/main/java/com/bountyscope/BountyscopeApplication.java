package com.bountyscope;

import com.bountyscope.core.config.ConfigurationException;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class BountyscopeApplication {

    static final int EXIT_CONFIGURATION_ERROR = 2;

    public static void main(String[] args) {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(BountyscopeApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off");

        ApplicationContext ctx;
        try {
            ctx = builder.run(args);
        } catch (RuntimeException e) {
            ConfigurationException config = configurationCause(e);
            if (config == null) {
                throw e;
            }
            System.err.println("Configuration error: " + config.getMessage());
            System.exit(EXIT_CONFIGURATION_ERROR);
            return;
        }

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }

    static ConfigurationException configurationCause(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ConfigurationException config) {
                return config;
            }
            current = current.getCause();
        }
        return null;
    }
}
