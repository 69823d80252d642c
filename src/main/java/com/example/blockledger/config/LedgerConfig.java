package com.example.blockledger.config;

import com.example.blockledger.consensus.ConsensusEngine;
import com.example.blockledger.consensus.ConsensusSettings;
import com.example.blockledger.ledger.BlockHasher;
import com.example.blockledger.ledger.Ledger;
import com.example.blockledger.ledger.LedgerSettings;
import com.example.blockledger.model.ConsensusType;
import com.example.blockledger.service.BlockProducer;
import com.example.blockledger.service.BlockProductionSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Random;

@Configuration
public class LedgerConfig {

    // Ledger
    @Value("${ledger.difficulty.initial:4}")
    private int initialDifficulty;

    @Value("${ledger.difficulty.min:1}")
    private int minDifficulty;

    @Value("${ledger.difficulty.max:5}")
    private int maxDifficulty;

    @Value("${ledger.difficulty.adjustment-enabled:true}")
    private boolean difficultyAdjustmentEnabled;

    @Value("${ledger.target-block-time-ms:10000}")
    private long targetBlockTimeMs;

    @Value("${ledger.mining-reward:10}")
    private BigDecimal miningReward;

    @Value("${ledger.max-mining-duration-ms:5000}")
    private long maxMiningDurationMs;

    @Value("${ledger.fee.minimum:0.001}")
    private BigDecimal minimumFee;

    @Value("${ledger.fee.rate:0.001}")
    private BigDecimal feeRate;

    // Consensus
    @Value("${consensus.type:hybrid}")
    private String consensusType;

    @Value("${consensus.minimum-stake:32}")
    private BigDecimal minimumStake;

    @Value("${consensus.slashing-penalty:0.1}")
    private BigDecimal slashingPenalty;

    @Value("${consensus.reputation-penalty:10}")
    private int reputationPenalty;

    @Value("${consensus.selection-threshold:0.1}")
    private BigDecimal selectionThreshold;

    @Value("${consensus.max-future-drift-ms:60000}")
    private long maxFutureDriftMs;

    @Value("${consensus.max-past-drift-ms:3600000}")
    private long maxPastDriftMs;

    // Block production
    @Value("${mining.ring-buffer-size:1024}")
    private int ringBufferSize;

    @Value("${mining.auto.enabled:false}")
    private boolean autoEnabled;

    @Value("${mining.auto.interval-ms:10000}")
    private long autoIntervalMs;

    @Value("${mining.auto.miner-address:}")
    private String autoMinerAddress;

    @Value("${mining.session.interval-ms:5000}")
    private long sessionIntervalMs;

    @Value("${mining.session.max-duration-ms:300000}")
    private long sessionMaxDurationMs;

    @Value("${mining.session.retention-ms:3600000}")
    private long sessionRetentionMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BlockHasher blockHasher() {
        return new BlockHasher();
    }

    @Bean
    public LedgerSettings ledgerSettings() {
        return LedgerSettings.builder()
                .initialDifficulty(initialDifficulty)
                .minDifficulty(minDifficulty)
                .maxDifficulty(maxDifficulty)
                .difficultyAdjustmentEnabled(difficultyAdjustmentEnabled)
                .targetBlockTimeMs(targetBlockTimeMs)
                .miningReward(miningReward)
                .maxMiningDurationMs(maxMiningDurationMs)
                .minimumFee(minimumFee)
                .feeRate(feeRate)
                .build();
    }

    @Bean
    public ConsensusSettings consensusSettings() {
        return ConsensusSettings.builder()
                .consensusType(ConsensusType.fromValue(consensusType))
                .minimumStake(minimumStake)
                .slashingPenalty(slashingPenalty)
                .reputationPenalty(reputationPenalty)
                .selectionThreshold(selectionThreshold)
                .maxFutureDriftMs(maxFutureDriftMs)
                .maxPastDriftMs(maxPastDriftMs)
                .build();
    }

    @Bean
    public BlockProductionSettings blockProductionSettings() {
        return BlockProductionSettings.builder()
                .ringBufferSize(ringBufferSize)
                .autoEnabled(autoEnabled)
                .autoIntervalMs(autoIntervalMs)
                .autoMinerAddress(autoMinerAddress)
                .sessionIntervalMs(sessionIntervalMs)
                .sessionMaxDurationMs(sessionMaxDurationMs)
                .sessionRetentionMs(sessionRetentionMs)
                .build();
    }

    @Bean
    public ConsensusEngine consensusEngine(ConsensusSettings consensusSettings, BlockHasher blockHasher, Clock clock) {
        return new ConsensusEngine(consensusSettings, blockHasher, clock, new Random());
    }

    @Bean
    public Ledger ledger(LedgerSettings ledgerSettings, BlockHasher blockHasher,
                         ConsensusEngine consensusEngine, Clock clock) {
        return new Ledger(ledgerSettings, blockHasher, consensusEngine, clock);
    }

    @Bean
    public BlockProducer blockProducer(Ledger ledger, ConsensusEngine consensusEngine,
                                       BlockProductionSettings blockProductionSettings, Clock clock) {
        return new BlockProducer(ledger, consensusEngine, blockProductionSettings, clock);
    }
}
