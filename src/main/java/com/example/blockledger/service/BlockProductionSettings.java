package com.example.blockledger.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BlockProductionSettings {
    @Builder.Default
    int ringBufferSize = 1024;
    @Builder.Default
    boolean autoEnabled = false;
    @Builder.Default
    long autoIntervalMs = 10_000;
    // used when no validator can be selected
    @Builder.Default
    String autoMinerAddress = "";
    @Builder.Default
    long sessionIntervalMs = 5_000;
    @Builder.Default
    long sessionMaxDurationMs = 300_000;
    // how long an ended session stays queryable
    @Builder.Default
    long sessionRetentionMs = 3_600_000;
}
