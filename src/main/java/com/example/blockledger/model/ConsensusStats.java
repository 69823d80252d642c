package com.example.blockledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ConsensusStats {
    String consensusType;
    int totalValidators;
    int activeValidators;
    BigDecimal totalStake;
    BigDecimal minimumStake;
    double averageReputation;
}
