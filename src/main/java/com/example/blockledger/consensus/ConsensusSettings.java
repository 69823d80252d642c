package com.example.blockledger.consensus;

import com.example.blockledger.model.ConsensusType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ConsensusSettings {
    @Builder.Default
    ConsensusType consensusType = ConsensusType.HYBRID;
    @Builder.Default
    BigDecimal minimumStake = new BigDecimal("32");
    // fraction of current stake removed per slash
    @Builder.Default
    BigDecimal slashingPenalty = new BigDecimal("0.1");
    @Builder.Default
    int reputationPenalty = 10;
    @Builder.Default
    int initialReputation = 100;
    // stake share a miner must exceed under proof of stake
    @Builder.Default
    BigDecimal selectionThreshold = new BigDecimal("0.1");
    @Builder.Default
    long maxFutureDriftMs = 60_000;
    @Builder.Default
    long maxPastDriftMs = 3_600_000;
}
