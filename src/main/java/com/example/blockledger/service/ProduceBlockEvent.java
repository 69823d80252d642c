package com.example.blockledger.service;

import com.example.blockledger.model.Block;
import lombok.Data;

import java.util.concurrent.CompletableFuture;

@Data
public class ProduceBlockEvent {
    public enum Trigger {
        ON_DEMAND,
        SCHEDULED,
        SESSION
    }

    private String minerAddress;
    private Trigger trigger;
    private CompletableFuture<Block> future;
    private long requestedAt;

    // ring slots are reused
    public void clear() {
        minerAddress = null;
        trigger = null;
        future = null;
        requestedAt = 0;
    }
}
