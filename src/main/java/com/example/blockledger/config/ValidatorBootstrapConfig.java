package com.example.blockledger.config;

import com.example.blockledger.consensus.ConsensusEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;

/**
 * Registers the genesis validator set from {@code consensus.genesis-validators}, a list of
 * {@code address:stake} entries.
 */
@Slf4j
@Configuration
public class ValidatorBootstrapConfig {

    @Value("${consensus.genesis-validators:}")
    private List<String> genesisValidators;

    @Bean
    public CommandLineRunner registerGenesisValidators(ConsensusEngine consensusEngine) {
        return args -> {
            if (genesisValidators == null || genesisValidators.isEmpty()) {
                log.info("No genesis validators configured");
                return;
            }

            int registered = 0;
            for (String entry : genesisValidators) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int separator = entry.lastIndexOf(':');
                if (separator <= 0 || separator == entry.length() - 1) {
                    log.warn("Skipping malformed genesis validator entry: {}", entry);
                    continue;
                }

                String address = entry.substring(0, separator).trim();
                BigDecimal stake;
                try {
                    stake = new BigDecimal(entry.substring(separator + 1).trim());
                } catch (NumberFormatException e) {
                    log.warn("Skipping genesis validator {} with invalid stake: {}", address, e.getMessage());
                    continue;
                }

                if (consensusEngine.addValidator(address, stake)) {
                    registered++;
                }
            }
            log.info("Genesis validators registered: {}/{}", registered, genesisValidators.size());
        };
    }
}
