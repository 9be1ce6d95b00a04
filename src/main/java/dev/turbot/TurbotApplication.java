package dev.turbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the TurBot travel search application.
 *
 * <p>Exposes constraint-aware travel search as MCP tools over the stdio transport.
 */
@SpringBootApplication
public class TurbotApplication {
    public static void main(String[] args) {
        SpringApplication.run(TurbotApplication.class, args);
    }
}
