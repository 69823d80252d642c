package com.example.blockledger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MiningSession {
    private String id;
    private String minerAddress;
    private long startTime;
    private long endTime;
    private boolean active;
    private long attempts;
    private long blocksFound;
    private BigDecimal earnings;

    public MiningSession snapshot() {
        return toBuilder().build();
    }
}
