package com.example.blockledger.controller;

import com.example.blockledger.dto.MinerRequest;
import com.example.blockledger.model.MiningSession;
import com.example.blockledger.service.BlockProducer;
import com.example.blockledger.service.ChainService;
import com.example.blockledger.service.MiningSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api/mining")
@Tag(name = "Mining API", description = "Block production and mining sessions")
public class MiningController {

    @Autowired
    private ChainService chainService;

    @Autowired
    private MiningSessionService miningSessionService;

    @PostMapping("/blocks")
    @Operation(summary = "Mine block", description = "Mine the pending pool into a block; without a miner address the leader is selected by stake")
    public CompletableFuture<ResponseEntity<ChainService.MiningOutcome>> mineBlock(
            @RequestBody(required = false) MinerRequest request) {
        String miner = request != null ? request.getMinerAddress() : null;
        log.info("Mining block for: {}", miner != null ? miner : "<leader>");

        return chainService.mineBlock(miner)
                .thenApply(ResponseEntity::ok)
                .exceptionally(ex -> {
                    String msg = ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage();
                    log.error("Block production failed: {}", msg);
                    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(new ChainService.MiningOutcome(false, msg, null));
                });
    }

    @GetMapping("/metrics")
    @Operation(summary = "Producer metrics", description = "Blocks produced, empty rounds and failed rounds")
    public ResponseEntity<BlockProducer.Metrics> getMetrics() {
        return ResponseEntity.ok(chainService.getProducerMetrics());
    }

    @PostMapping("/sessions")
    @Operation(summary = "Start mining session")
    public ResponseEntity<MiningSession> startSession(@RequestBody MinerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(miningSessionService.startSession(request.getMinerAddress()));
    }

    @PostMapping("/sessions/{sessionId}/stop")
    @Operation(summary = "Stop mining session")
    public ResponseEntity<MiningSession> stopSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(miningSessionService.stopSession(sessionId));
    }

    @GetMapping("/sessions/{sessionId}")
    @Operation(summary = "Get mining session")
    public ResponseEntity<MiningSession> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(miningSessionService.getSession(sessionId));
    }

    @GetMapping("/sessions")
    @Operation(summary = "List mining sessions", description = "Sessions of one miner, or all active sessions")
    public ResponseEntity<List<MiningSession>> getSessions(
            @Parameter(description = "Miner address; omit to list active sessions")
            @RequestParam(required = false) String minerAddress) {
        if (minerAddress == null || minerAddress.isBlank()) {
            return ResponseEntity.ok(miningSessionService.getActiveSessions());
        }
        return ResponseEntity.ok(miningSessionService.getSessions(minerAddress));
    }
}
