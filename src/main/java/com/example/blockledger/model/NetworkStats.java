package com.example.blockledger.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NetworkStats {
    long blockHeight;
    int chainLength;
    long totalTransactions;
    int pendingTransactions;
    int difficulty;
    // seconds
    long averageBlockTime;
    String networkHashRate;
    String latestBlockHash;
}
