package com.example.blockledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LedgerSettings {
    @Builder.Default
    int initialDifficulty = 4;
    @Builder.Default
    int minDifficulty = 1;
    @Builder.Default
    int maxDifficulty = 5;
    @Builder.Default
    boolean difficultyAdjustmentEnabled = true;
    @Builder.Default
    long targetBlockTimeMs = 10_000;
    @Builder.Default
    BigDecimal miningReward = BigDecimal.TEN;
    // upper bound for a single nonce search
    @Builder.Default
    long maxMiningDurationMs = 5_000;
    @Builder.Default
    BigDecimal minimumFee = new BigDecimal("0.001");
    @Builder.Default
    BigDecimal feeRate = new BigDecimal("0.001");
}
