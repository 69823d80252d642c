package com.example.blockledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
public class BlockLedgerApplication {

    private static ConfigurableApplicationContext context;

    public static void main(String[] args) {
        System.setProperty("spring.main.register-shutdown-hook", "true");
        System.setProperty("logging.register-shutdown-hook", "false");

        context = SpringApplication.run(BlockLedgerApplication.class, args);

        // Add shutdown hook for graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received. Stopping block production...");
            try {
                context.close();
                log.info("Application shutdown completed successfully");
            } catch (Exception e) {
                log.error("Error during application shutdown", e);
            }
        }, "shutdown-hook"));

        log.info("Block ledger started. Press Ctrl+C to shutdown gracefully.");
    }
}
