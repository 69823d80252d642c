package com.example.blockledger.service;

import com.example.blockledger.exception.InvalidRequestException;
import com.example.blockledger.exception.SessionNotFoundException;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.MiningSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MiningSessionServiceTest {

    private static final long START = 1_700_000_000_000L;

    private BlockProducer blockProducer;
    private Clock clock;
    private MiningSessionService service;

    @BeforeEach
    void setUp() {
        blockProducer = mock(BlockProducer.class);
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(START);
        BlockProductionSettings settings = BlockProductionSettings.builder()
                .sessionIntervalMs(3_600_000)
                .sessionMaxDurationMs(60_000)
                .sessionRetentionMs(10_000)
                .build();
        service = new MiningSessionService(blockProducer, settings, clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void startSessionRequiresMinerAddress() {
        assertThatThrownBy(() -> service.startSession(" ")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.startSession(null)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void newSessionIsActiveWithEmptyTotals() {
        MiningSession session = service.startSession("M1");

        assertThat(session.getId()).startsWith("session_");
        assertThat(session.getMinerAddress()).isEqualTo("M1");
        assertThat(session.isActive()).isTrue();
        assertThat(session.getStartTime()).isEqualTo(START);
        assertThat(session.getAttempts()).isZero();
        assertThat(session.getBlocksFound()).isZero();
        assertThat(session.getEarnings()).isEqualByComparingTo("0");
        assertThat(service.getActiveSessions()).extracting(MiningSession::getId).containsExactly(session.getId());
    }

    @Test
    void tickRecordsFoundBlockAndEarnings() {
        when(blockProducer.requestBlock(eq("M1"), any()))
                .thenReturn(CompletableFuture.completedFuture(block("M1", "10")));
        MiningSession session = service.startSession("M1");

        service.tick(session.getId());
        service.tick(session.getId());

        MiningSession updated = service.getSession(session.getId());
        assertThat(updated.getAttempts()).isEqualTo(2);
        assertThat(updated.getBlocksFound()).isEqualTo(2);
        assertThat(updated.getEarnings()).isEqualByComparingTo("20");
        verify(blockProducer, times(2)).requestBlock("M1", ProduceBlockEvent.Trigger.SESSION);
    }

    @Test
    void tickWithoutBlockOnlyCountsAttempt() {
        when(blockProducer.requestBlock(eq("M1"), any())).thenReturn(CompletableFuture.completedFuture(null));
        MiningSession session = service.startSession("M1");

        service.tick(session.getId());

        MiningSession updated = service.getSession(session.getId());
        assertThat(updated.getAttempts()).isEqualTo(1);
        assertThat(updated.getBlocksFound()).isZero();
    }

    @Test
    void tickSkipsWhilePreviousRequestIsPending() {
        CompletableFuture<Block> pending = new CompletableFuture<>();
        when(blockProducer.requestBlock(eq("M1"), any())).thenReturn(pending);
        MiningSession session = service.startSession("M1");

        service.tick(session.getId());
        service.tick(session.getId());
        assertThat(service.getSession(session.getId()).getAttempts()).isEqualTo(1);

        pending.complete(block("M1", "10"));

        assertThat(service.getSession(session.getId()).getBlocksFound()).isEqualTo(1);
    }

    @Test
    void failedRequestDoesNotEndSession() {
        when(blockProducer.requestBlock(eq("M1"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Block producer is not running")));
        MiningSession session = service.startSession("M1");

        service.tick(session.getId());

        MiningSession updated = service.getSession(session.getId());
        assertThat(updated.isActive()).isTrue();
        assertThat(updated.getBlocksFound()).isZero();
    }

    @Test
    void sessionExpiresAfterMaxDuration() {
        MiningSession session = service.startSession("M1");
        when(clock.millis()).thenReturn(START + 60_000);

        service.tick(session.getId());

        MiningSession expired = service.getSession(session.getId());
        assertThat(expired.isActive()).isFalse();
        assertThat(expired.getEndTime()).isEqualTo(START + 60_000);
        assertThat(expired.getAttempts()).isZero();
        assertThat(service.getActiveSessions()).isEmpty();
    }

    @Test
    void stoppedSessionNoLongerMines() {
        MiningSession session = service.startSession("M1");

        MiningSession stopped = service.stopSession(session.getId());
        service.tick(session.getId());

        assertThat(stopped.isActive()).isFalse();
        assertThat(service.getSession(session.getId()).getAttempts()).isZero();
        verify(blockProducer, times(0)).requestBlock(any(), any());
    }

    @Test
    void endedSessionsAreEvictedAfterRetention() {
        MiningSession ended = service.startSession("M1");
        MiningSession running = service.startSession("M1");
        service.stopSession(ended.getId());

        when(clock.millis()).thenReturn(START + 9_999);
        assertThat(service.evictEndedSessions()).isZero();
        assertThat(service.getSession(ended.getId()).isActive()).isFalse();

        when(clock.millis()).thenReturn(START + 10_000);
        assertThat(service.evictEndedSessions()).isEqualTo(1);

        assertThatThrownBy(() -> service.getSession(ended.getId())).isInstanceOf(SessionNotFoundException.class);
        assertThat(service.getSession(running.getId()).isActive()).isTrue();
        assertThat(service.getSessions("M1")).extracting(MiningSession::getId).containsExactly(running.getId());
    }

    @Test
    void unknownSessionIsReported() {
        assertThatThrownBy(() -> service.getSession("session_missing")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.stopSession("session_missing")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void sessionsAreListedPerMiner() {
        MiningSession first = service.startSession("M1");
        service.startSession("M2");
        MiningSession second = service.startSession("M1");
        service.stopSession(first.getId());

        List<MiningSession> sessions = service.getSessions("M1");

        assertThat(sessions).extracting(MiningSession::getId).containsExactlyInAnyOrder(first.getId(), second.getId());
        assertThat(service.getActiveSessions()).hasSize(2);
        assertThat(service.getSessions("nobody")).isEmpty();
    }

    @Test
    void returnedSessionsAreSnapshots() {
        MiningSession session = service.startSession("M1");

        session.setActive(false);
        session.setBlocksFound(99);

        MiningSession stored = service.getSession(session.getId());
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.getBlocksFound()).isZero();
    }

    private static Block block(String miner, String reward) {
        return Block.builder()
                .index(1)
                .timestamp(START)
                .transactions(List.of())
                .previousHash("0")
                .hash("0".repeat(64))
                .merkleRoot("")
                .miner(miner)
                .reward(new BigDecimal(reward))
                .build();
    }
}
