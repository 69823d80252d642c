package com.example.blockledger.service;

import com.example.blockledger.consensus.ConsensusEngine;
import com.example.blockledger.consensus.ConsensusSettings;
import com.example.blockledger.ledger.BlockHasher;
import com.example.blockledger.ledger.Ledger;
import com.example.blockledger.ledger.LedgerSettings;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.ConsensusType;
import com.example.blockledger.model.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BlockProducerTest {

    private final BlockHasher blockHasher = new BlockHasher();
    private final Clock clock = Clock.systemUTC();

    private BlockProducer producer;

    @AfterEach
    void tearDown() {
        if (producer != null) {
            producer.stop();
        }
    }

    @Test
    void producesBlockForRequestedMiner() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POW);
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());
        ledger.addTransaction(ledger.createTransaction("A", "B", BigDecimal.ONE, "k"));

        Block block = producer.requestBlock("M1").get(10, TimeUnit.SECONDS);

        assertThat(block).isNotNull();
        assertThat(block.getMiner()).isEqualTo("M1");
        assertThat(ledger.getChainLength()).isEqualTo(2);
        assertThat(producer.getMetrics().getBlocksProduced()).isEqualTo(1);
    }

    @Test
    void emptyPoolCompletesWithNull() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POW);
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());

        assertThat(producer.requestBlock("M1").get(10, TimeUnit.SECONDS)).isNull();
        assertThat(producer.getMetrics().getEmptyRounds()).isEqualTo(1);
        assertThat(ledger.getChainLength()).isEqualTo(1);
    }

    @Test
    void missingMinerIsResolvedThroughLeaderSelection() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POS);
        engine.addValidator("V1", new BigDecimal("100"));
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());
        ledger.addTransaction(ledger.createTransaction("A", "B", BigDecimal.ONE, "k"));

        Block block = producer.requestBlock(null).get(10, TimeUnit.SECONDS);

        assertThat(block).isNotNull();
        assertThat(block.getMiner()).isEqualTo("V1");
    }

    @Test
    void noLeaderAndNoFallbackCountsAsFailedRound() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POS);
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());
        ledger.addTransaction(ledger.createTransaction("A", "B", BigDecimal.ONE, "k"));

        assertThat(producer.requestBlock("").get(10, TimeUnit.SECONDS)).isNull();
        assertThat(producer.getMetrics().getFailedRounds()).isEqualTo(1);
        assertThat(ledger.getPendingCount()).isEqualTo(1);
    }

    @Test
    void consensusRejectionCountsAsFailedRound() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.HYBRID);
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());
        ledger.addTransaction(ledger.createTransaction("A", "B", BigDecimal.ONE, "k"));

        assertThat(producer.requestBlock("not-a-validator").get(10, TimeUnit.SECONDS)).isNull();
        assertThat(producer.getMetrics().getFailedRounds()).isEqualTo(1);
        assertThat(ledger.getPendingCount()).isEqualTo(1);
    }

    @Test
    void ledgerFailureCompletesFutureExceptionallyAndKeepsWorkerAlive() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POW);
        Ledger failing = mock(Ledger.class);
        when(failing.getPendingCount()).thenReturn(1);
        when(failing.mineBlock(anyString())).thenThrow(new IllegalStateException("boom"));
        producer = started(failing, engine, BlockProductionSettings.builder().build());

        CompletableFuture<Block> first = producer.requestBlock("M1");
        assertThatThrownBy(() -> first.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        CompletableFuture<Block> second = producer.requestBlock("M1");
        assertThatThrownBy(() -> second.get(10, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
        assertThat(producer.getMetrics().getFailedRounds()).isEqualTo(2);
    }

    @Test
    void requestsAfterStopFail() {
        ConsensusEngine engine = engine(ConsensusType.POW);
        producer = started(ledger(engine), engine, BlockProductionSettings.builder().build());
        producer.stop();

        CompletableFuture<Block> future = producer.requestBlock("M1");

        assertThat(producer.isRunning()).isFalse();
        assertThat(future).isCompletedExceptionally();
        producer = null;
    }

    @Test
    void concurrentRequestsProduceLinkedChain() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POW);
        Ledger ledger = ledger(engine);
        producer = started(ledger, engine, BlockProductionSettings.builder().build());

        ExecutorService clients = Executors.newFixedThreadPool(4);
        List<CompletableFuture<Block>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                String miner = "M" + (i % 4);
                futures.add(CompletableFuture.supplyAsync(() -> {
                    Transaction tx = ledger.createTransaction(miner, "B", BigDecimal.ONE, "k");
                    ledger.addTransaction(tx);
                    return miner;
                }, clients).thenCompose(producer::requestBlock));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);
        } finally {
            clients.shutdownNow();
        }

        List<Block> chain = ledger.getChain();
        for (int i = 1; i < chain.size(); i++) {
            assertThat(chain.get(i).getIndex()).isEqualTo(i);
            assertThat(chain.get(i).getPreviousHash()).isEqualTo(chain.get(i - 1).getHash());
        }
        long committed = chain.stream().mapToLong(b -> b.getTransactions().size()).sum();
        assertThat(committed + ledger.getPendingCount()).isEqualTo(20);
        assertThat(ledger.getPendingCount()).isZero();
        assertThat(ledger.validateChain()).isTrue();
    }

    @Test
    void scheduledProductionMinesPendingTransactions() throws Exception {
        ConsensusEngine engine = engine(ConsensusType.POW);
        Ledger ledger = ledger(engine);
        BlockProductionSettings settings = BlockProductionSettings.builder()
                .autoEnabled(true)
                .autoIntervalMs(50)
                .autoMinerAddress("AUTO")
                .build();
        producer = started(ledger, engine, settings);
        ledger.addTransaction(ledger.createTransaction("A", "B", BigDecimal.ONE, "k"));

        long deadline = System.currentTimeMillis() + 10_000;
        while (ledger.getChainLength() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(ledger.getChainLength()).isEqualTo(2);
        assertThat(ledger.getLatestBlock().getMiner()).isEqualTo("AUTO");
    }

    private BlockProducer started(Ledger ledger, ConsensusEngine engine, BlockProductionSettings settings) {
        BlockProducer blockProducer = new BlockProducer(ledger, engine, settings, clock);
        blockProducer.start();
        return blockProducer;
    }

    private ConsensusEngine engine(ConsensusType type) {
        return new ConsensusEngine(ConsensusSettings.builder().consensusType(type).build(), blockHasher, clock, new Random(1));
    }

    private Ledger ledger(ConsensusEngine engine) {
        LedgerSettings settings = LedgerSettings.builder()
                .initialDifficulty(1)
                .minDifficulty(1)
                .maxDifficulty(1)
                .difficultyAdjustmentEnabled(false)
                .maxMiningDurationMs(30_000)
                .build();
        return new Ledger(settings, blockHasher, engine, clock);
    }
}
