package com.example.blockledger.service;

import com.example.blockledger.consensus.ConsensusEngine;
import com.example.blockledger.consensus.ConsensusSettings;
import com.example.blockledger.exception.InvalidRequestException;
import com.example.blockledger.ledger.BlockHasher;
import com.example.blockledger.ledger.Ledger;
import com.example.blockledger.ledger.LedgerSettings;
import com.example.blockledger.model.ChainStats;
import com.example.blockledger.model.ConsensusType;
import com.example.blockledger.model.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainServiceTest {

    private final BlockHasher blockHasher = new BlockHasher();
    private final Clock clock = Clock.systemUTC();

    private ConsensusEngine consensusEngine;
    private Ledger ledger;
    private BlockProducer blockProducer;
    private ChainService chainService;

    @BeforeEach
    void setUp() {
        consensusEngine = new ConsensusEngine(
                ConsensusSettings.builder().consensusType(ConsensusType.HYBRID).build(), blockHasher, clock, new Random(3));
        ledger = new Ledger(LedgerSettings.builder()
                .initialDifficulty(1)
                .maxDifficulty(1)
                .difficultyAdjustmentEnabled(false)
                .maxMiningDurationMs(30_000)
                .build(), blockHasher, consensusEngine, clock);
        blockProducer = new BlockProducer(ledger, consensusEngine, BlockProductionSettings.builder().build(), clock);
        blockProducer.start();
        chainService = new ChainService(ledger, consensusEngine, blockProducer, clock);
    }

    @AfterEach
    void tearDown() {
        blockProducer.stop();
    }

    @Test
    void negativeLimitIsRejected() {
        assertThatThrownBy(() -> chainService.getChain(-1)).isInstanceOf(InvalidRequestException.class);
        assertThat(chainService.getChain(0)).isEmpty();
        assertThat(chainService.getChain(5)).hasSize(1);
    }

    @Test
    void miningWithEmptyPoolReportsNoPendingTransactions() throws Exception {
        ChainService.MiningOutcome outcome = chainService.mineBlock("V1").get(10, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo(ChainService.NO_PENDING_TRANSACTIONS);
        assertThat(outcome.getBlock()).isNull();
    }

    @Test
    void createdTransactionIsQueuedAndMinedByValidator() throws Exception {
        chainService.addValidator("V1", new BigDecimal("100"));
        Transaction transaction = chainService.createTransaction("A", "B", new BigDecimal("10"), "key");

        assertThat(chainService.getPendingTransactions()).containsExactly(transaction);

        ChainService.MiningOutcome outcome = chainService.mineBlock("V1").get(30, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getBlock().getTransactions()).containsExactly(transaction);
        assertThat(chainService.getBalance("B")).isEqualByComparingTo("10");
        assertThat(chainService.getBalance("V1")).isEqualByComparingTo("10");
        assertThat(chainService.validateChain()).isTrue();
    }

    @Test
    void leaderMinesWhenNoMinerIsGiven() throws Exception {
        chainService.addValidator("V1", new BigDecimal("100"));
        chainService.createTransaction("A", "B", BigDecimal.ONE, "key");

        ChainService.MiningOutcome outcome = chainService.mineBlock(null).get(30, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getBlock().getMiner()).isEqualTo("V1");
    }

    @Test
    void rejectedBlockKeepsTransactionsPending() throws Exception {
        chainService.createTransaction("A", "B", BigDecimal.ONE, "key");

        ChainService.MiningOutcome outcome = chainService.mineBlock("not-a-validator").get(30, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).isNotEqualTo(ChainService.NO_PENDING_TRANSACTIONS);
        assertThat(chainService.getPendingTransactions()).hasSize(1);
    }

    @Test
    void statsCombineNetworkAndConsensus() {
        chainService.addValidator("V1", new BigDecimal("100"));
        chainService.createTransaction("A", "B", BigDecimal.ONE, "key");

        ChainStats stats = chainService.getStats();

        assertThat(stats.getNetwork().getChainLength()).isEqualTo(1);
        assertThat(stats.getNetwork().getPendingTransactions()).isEqualTo(1);
        assertThat(stats.getConsensus().getActiveValidators()).isEqualTo(1);
        assertThat(stats.getLastBlockTime()).isEqualTo(ledger.getLatestBlock().getTimestamp());
        assertThat(stats.getTimestamp()).isGreaterThanOrEqualTo(stats.getLastBlockTime());
    }

    @Test
    void validatorOverviewListsRegistryAndStats() {
        chainService.addValidator("V1", new BigDecimal("100"));
        chainService.addValidator("V2", new BigDecimal("50"));
        chainService.slashValidator("V2", "offline");

        ChainService.ValidatorOverview overview = chainService.getValidators();

        assertThat(overview.getValidators()).hasSize(2);
        assertThat(overview.getStats().getTotalStake()).isEqualByComparingTo("145");
        assertThat(chainService.getValidator("V2")).hasValueSatisfying(v -> assertThat(v.getReputation()).isEqualTo(90));
    }
}
