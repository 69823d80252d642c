package com.example.blockledger.controller;

import com.example.blockledger.dto.CreateTransactionRequest;
import com.example.blockledger.dto.OperationResponse;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.ChainStats;
import com.example.blockledger.model.Transaction;
import com.example.blockledger.service.ChainService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/chain")
@Tag(name = "Chain API", description = "Blocks, pending pool, transactions and balances")
public class ChainController {

    @Autowired
    private ChainService chainService;

    @GetMapping("/stats")
    @Operation(summary = "Chain statistics", description = "Network and consensus summary")
    public ResponseEntity<ChainStats> getStats() {
        return ResponseEntity.ok(chainService.getStats());
    }

    @GetMapping("/blocks")
    @Operation(summary = "Recent blocks", description = "The most recent blocks in chain order")
    public ResponseEntity<List<Block>> getBlocks(
            @Parameter(description = "Number of blocks to return")
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(chainService.getChain(limit));
    }

    @GetMapping("/pending")
    @Operation(summary = "Pending transactions", description = "Transactions waiting for the next block, oldest first")
    public ResponseEntity<List<Transaction>> getPending() {
        return ResponseEntity.ok(chainService.getPendingTransactions());
    }

    @PostMapping("/transactions/create")
    @Operation(summary = "Create transaction", description = "Build, sign and queue a transaction")
    public ResponseEntity<Object> createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
        log.info("Creating transaction: {} -> {}, amount: {}", request.getFrom(), request.getTo(), request.getAmount());

        Transaction transaction = chainService.createTransaction(
                request.getFrom(), request.getTo(), request.getAmount(), request.getKey());
        if (transaction == null) {
            return ResponseEntity.badRequest().body(new OperationResponse(false, "Transaction rejected"));
        }
        return ResponseEntity.ok(transaction);
    }

    @PostMapping("/transactions")
    @Operation(summary = "Submit transaction", description = "Queue an externally built transaction")
    public ResponseEntity<OperationResponse> addTransaction(@RequestBody Transaction transaction) {
        log.info("Submitting transaction: {}", transaction.getId());

        if (chainService.addTransaction(transaction)) {
            return ResponseEntity.ok(new OperationResponse(true, "Transaction added to pending pool"));
        }
        return ResponseEntity.badRequest().body(new OperationResponse(false, "Transaction rejected"));
    }

    @GetMapping("/validate")
    @Operation(summary = "Validate chain", description = "Recompute hashes, Merkle roots and links of every block")
    public ResponseEntity<ChainValidationResponse> validateChain() {
        boolean valid = chainService.validateChain();
        log.info("Chain validation result: {}", valid);
        return ResponseEntity.ok(new ChainValidationResponse(valid, System.currentTimeMillis()));
    }

    @GetMapping("/balances/{address}")
    @Operation(summary = "Account balance", description = "Balance replayed from committed blocks")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String address) {
        return ResponseEntity.ok(new BalanceResponse(address, chainService.getBalance(address)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChainValidationResponse {
        private boolean valid;
        private long checkedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BalanceResponse {
        private String address;
        private BigDecimal balance;
    }
}
