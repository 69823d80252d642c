package com.example.blockledger.service;

import com.example.blockledger.exception.InvalidRequestException;
import com.example.blockledger.exception.SessionNotFoundException;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.MiningSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Long-running mining sessions. Each active session asks the block producer for a block on
 * every tick and ends on request or once its maximum duration has passed.
 */
@Slf4j
@Service
public class MiningSessionService {

    private final BlockProducer blockProducer;
    private final BlockProductionSettings settings;
    private final Clock clock;

    private final Map<String, MiningSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> tickTasks = new ConcurrentHashMap<>();
    // sessions with a block request still in the producer queue
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;

    public MiningSessionService(BlockProducer blockProducer, BlockProductionSettings settings, Clock clock) {
        this.blockProducer = blockProducer;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "mining-session-ticker");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::evictEndedSessions,
                settings.getSessionIntervalMs(), settings.getSessionIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public MiningSession startSession(String minerAddress) {
        if (minerAddress == null || minerAddress.isBlank()) {
            throw new InvalidRequestException("Miner address is required");
        }

        MiningSession session = MiningSession.builder()
                .id("session_" + UUID.randomUUID())
                .minerAddress(minerAddress)
                .startTime(clock.millis())
                .active(true)
                .earnings(BigDecimal.ZERO)
                .build();

        synchronized (this) {
            sessions.put(session.getId(), session);
            tickTasks.put(session.getId(), scheduler.scheduleAtFixedRate(() -> tick(session.getId()),
                    settings.getSessionIntervalMs(), settings.getSessionIntervalMs(), TimeUnit.MILLISECONDS));
        }

        log.info("Mining session {} started for {}", session.getId(), minerAddress);
        return getSession(session.getId());
    }

    public MiningSession stopSession(String sessionId) {
        synchronized (this) {
            MiningSession session = sessions.get(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            if (session.isActive()) {
                endSession(session, "stopped");
            }
            return session.snapshot();
        }
    }

    public synchronized MiningSession getSession(String sessionId) {
        MiningSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session.snapshot();
    }

    public synchronized List<MiningSession> getSessions(String minerAddress) {
        List<MiningSession> result = new ArrayList<>();
        for (MiningSession session : sessions.values()) {
            if (session.getMinerAddress().equals(minerAddress)) {
                result.add(session.snapshot());
            }
        }
        result.sort(Comparator.comparingLong(MiningSession::getStartTime));
        return result;
    }

    public synchronized List<MiningSession> getActiveSessions() {
        List<MiningSession> result = new ArrayList<>();
        for (MiningSession session : sessions.values()) {
            if (session.isActive()) {
                result.add(session.snapshot());
            }
        }
        result.sort(Comparator.comparingLong(MiningSession::getStartTime));
        return result;
    }

    void tick(String sessionId) {
        String minerAddress;
        synchronized (this) {
            MiningSession session = sessions.get(sessionId);
            if (session == null || !session.isActive()) {
                return;
            }
            if (clock.millis() - session.getStartTime() >= settings.getSessionMaxDurationMs()) {
                endSession(session, "expired");
                return;
            }
            if (!inFlight.add(sessionId)) {
                return;
            }
            session.setAttempts(session.getAttempts() + 1);
            minerAddress = session.getMinerAddress();
        }

        blockProducer.requestBlock(minerAddress, ProduceBlockEvent.Trigger.SESSION)
                .whenComplete((block, ex) -> {
                    inFlight.remove(sessionId);
                    if (ex != null) {
                        log.warn("Mining session {} attempt failed: {}", sessionId, ex.getMessage());
                    } else if (block != null) {
                        recordBlock(sessionId, block);
                    }
                });
    }

    private synchronized void recordBlock(String sessionId, Block block) {
        MiningSession session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        session.setBlocksFound(session.getBlocksFound() + 1);
        session.setEarnings(session.getEarnings().add(block.getReward()));
        log.info("Mining session {} found block {} (reward {})", sessionId, block.getIndex(), block.getReward());
    }

    /**
     * Drop ended sessions whose retention period has passed.
     *
     * @return number of sessions removed
     */
    synchronized int evictEndedSessions() {
        long now = clock.millis();
        int before = sessions.size();
        sessions.values().removeIf(session ->
                !session.isActive() && now - session.getEndTime() >= settings.getSessionRetentionMs());
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.debug("Evicted {} ended mining sessions", evicted);
        }
        return evicted;
    }

    // caller holds the monitor
    private void endSession(MiningSession session, String reason) {
        session.setActive(false);
        session.setEndTime(clock.millis());
        ScheduledFuture<?> task = tickTasks.remove(session.getId());
        if (task != null) {
            task.cancel(false);
        }
        log.info("Mining session {} {}: attempts={}, blocksFound={}, earnings={}",
                session.getId(), reason, session.getAttempts(), session.getBlocksFound(), session.getEarnings());
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            for (MiningSession session : sessions.values()) {
                if (session.isActive()) {
                    endSession(session, "stopped");
                }
            }
        }
        scheduler.shutdownNow();
        log.info("MiningSessionService stopped - sessions: {}", sessions.size());
    }
}
