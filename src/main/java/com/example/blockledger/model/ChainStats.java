package com.example.blockledger.model;

import lombok.Builder;
import lombok.Value;

/**
 * Combined network and consensus summary served by the stats endpoint.
 */
@Value
@Builder
public class ChainStats {
    NetworkStats network;
    ConsensusStats consensus;
    long lastBlockTime;
    long timestamp;
}
