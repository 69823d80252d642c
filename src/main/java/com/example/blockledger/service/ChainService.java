package com.example.blockledger.service;

import com.example.blockledger.consensus.ConsensusEngine;
import com.example.blockledger.exception.InvalidRequestException;
import com.example.blockledger.ledger.Ledger;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.ChainStats;
import com.example.blockledger.model.ConsensusStats;
import com.example.blockledger.model.Transaction;
import com.example.blockledger.model.Validator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the HTTP layer: combines the ledger, the consensus engine and the block
 * producer behind one set of operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainService {

    public static final String NO_PENDING_TRANSACTIONS = "No pending transactions";

    private final Ledger ledger;
    private final ConsensusEngine consensusEngine;
    private final BlockProducer blockProducer;
    private final Clock clock;

    public ChainStats getStats() {
        return ChainStats.builder()
                .network(ledger.getNetworkStats())
                .consensus(consensusEngine.getConsensusStats())
                .lastBlockTime(ledger.getLatestBlock().getTimestamp())
                .timestamp(clock.millis())
                .build();
    }

    public List<Block> getChain(int limit) {
        if (limit < 0) {
            throw new InvalidRequestException("limit must not be negative: " + limit);
        }
        return ledger.getRecentBlocks(limit);
    }

    public List<Transaction> getPendingTransactions() {
        return ledger.getPendingTransactions();
    }

    public ValidatorOverview getValidators() {
        return new ValidatorOverview(consensusEngine.getValidators(), consensusEngine.getConsensusStats());
    }

    public Optional<Validator> getValidator(String address) {
        return consensusEngine.getValidator(address);
    }

    public String selectValidator() {
        return consensusEngine.selectValidator();
    }

    /**
     * Build, sign and queue a transaction.
     *
     * @return the transaction, or null if the pool refused it
     */
    public Transaction createTransaction(String from, String to, BigDecimal amount, String key) {
        Transaction transaction = ledger.createTransaction(from, to, amount, key);
        if (!ledger.addTransaction(transaction)) {
            log.warn("Created transaction {} was not accepted into the pool", transaction.getId());
            return null;
        }
        return transaction;
    }

    public boolean addTransaction(Transaction transaction) {
        return ledger.addTransaction(transaction);
    }

    /**
     * Ask the block producer for a block. A null miner lets consensus pick the leader.
     */
    public CompletableFuture<MiningOutcome> mineBlock(String minerAddress) {
        if (ledger.getPendingCount() == 0) {
            return CompletableFuture.completedFuture(MiningOutcome.failure(NO_PENDING_TRANSACTIONS));
        }

        return blockProducer.requestBlock(minerAddress).thenApply(block -> {
            if (block == null) {
                return ledger.getPendingCount() == 0
                        ? MiningOutcome.failure(NO_PENDING_TRANSACTIONS)
                        : MiningOutcome.failure("Block was not produced");
            }
            return MiningOutcome.success(block);
        });
    }

    public boolean validateChain() {
        return ledger.validateChain();
    }

    public boolean addValidator(String address, BigDecimal stake) {
        return consensusEngine.addValidator(address, stake);
    }

    public boolean slashValidator(String address, String reason) {
        return consensusEngine.slashValidator(address, reason);
    }

    public BigDecimal getBalance(String address) {
        return ledger.getAccountBalance(address);
    }

    public BlockProducer.Metrics getProducerMetrics() {
        return blockProducer.getMetrics();
    }

    @Value
    public static class ValidatorOverview {
        List<Validator> validators;
        ConsensusStats stats;
    }

    @Value
    public static class MiningOutcome {
        boolean success;
        String message;
        Block block;

        static MiningOutcome success(Block block) {
            return new MiningOutcome(true, "Block " + block.getIndex() + " mined", block);
        }

        static MiningOutcome failure(String message) {
            return new MiningOutcome(false, message, null);
        }
    }
}
