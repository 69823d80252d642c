package com.example.blockledger.service;

import com.example.blockledger.consensus.ConsensusEngine;
import com.example.blockledger.ledger.Ledger;
import com.example.blockledger.model.Block;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Funnels every block production request through a single Disruptor consumer, so blocks are
 * mined one at a time in request order.
 */
@Slf4j
public class BlockProducer {

    private final Ledger ledger;
    private final ConsensusEngine consensusEngine;
    private final BlockProductionSettings settings;
    private final Clock clock;

    private Disruptor<ProduceBlockEvent> disruptor;
    private RingBuffer<ProduceBlockEvent> ringBuffer;
    private ScheduledExecutorService scheduler;

    // Metrics
    private final AtomicLong blocksProduced = new AtomicLong(0);
    private final AtomicLong emptyRounds = new AtomicLong(0);
    private final AtomicLong failedRounds = new AtomicLong(0);
    private volatile boolean running = false;

    public BlockProducer(Ledger ledger, ConsensusEngine consensusEngine, BlockProductionSettings settings, Clock clock) {
        this.ledger = ledger;
        this.consensusEngine = consensusEngine;
        this.settings = settings;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger threadCount = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "block-producer-" + threadCount.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };

        // RingBuffer size must be a power of 2
        int requested = Math.max(1, settings.getRingBufferSize());
        int bufferSize = Integer.bitCount(requested) == 1 ? requested : Integer.highestOneBit(requested) << 1;

        disruptor = new Disruptor<>(
                ProduceBlockEvent::new,
                bufferSize,
                threadFactory,
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(new ProduceBlockHandler());
        ringBuffer = disruptor.start();
        running = true;

        if (settings.isAutoEnabled()) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "block-producer-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleAtFixedRate(this::produceScheduledBlock,
                    settings.getAutoIntervalMs(), settings.getAutoIntervalMs(), TimeUnit.MILLISECONDS);
        }

        log.info("BlockProducer started: ringBufferSize={}, autoEnabled={}, autoIntervalMs={}",
                bufferSize, settings.isAutoEnabled(), settings.getAutoIntervalMs());
    }

    @PreDestroy
    public void stop() {
        running = false;

        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        if (disruptor != null) {
            disruptor.shutdown();
        }

        log.info("BlockProducer stopped - blocks produced: {}, empty rounds: {}, failed rounds: {}",
                blocksProduced.get(), emptyRounds.get(), failedRounds.get());
    }

    /**
     * Request a block for the given miner. A null or blank miner lets consensus pick the leader.
     *
     * @return future completed with the committed block, or null when nothing was committed
     */
    public CompletableFuture<Block> requestBlock(String minerAddress) {
        return requestBlock(minerAddress, ProduceBlockEvent.Trigger.ON_DEMAND);
    }

    public CompletableFuture<Block> requestBlock(String minerAddress, ProduceBlockEvent.Trigger trigger) {
        CompletableFuture<Block> future = new CompletableFuture<>();
        if (!running) {
            log.warn("Block request from {} rejected: producer is not running", minerAddress);
            future.completeExceptionally(new IllegalStateException("Block producer is not running"));
            return future;
        }

        long sequence = ringBuffer.next();
        try {
            ProduceBlockEvent event = ringBuffer.get(sequence);
            event.setMinerAddress(minerAddress);
            event.setTrigger(trigger);
            event.setFuture(future);
            event.setRequestedAt(clock.millis());
        } finally {
            ringBuffer.publish(sequence);
        }
        return future;
    }

    private void produceScheduledBlock() {
        String miner = settings.getAutoMinerAddress().isBlank() ? null : settings.getAutoMinerAddress();
        requestBlock(miner, ProduceBlockEvent.Trigger.SCHEDULED);
    }

    public boolean isRunning() {
        return running;
    }

    public Metrics getMetrics() {
        return new Metrics(blocksProduced.get(), emptyRounds.get(), failedRounds.get());
    }

    @Value
    public static class Metrics {
        long blocksProduced;
        long emptyRounds;
        long failedRounds;
    }

    private String resolveMiner(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        String leader = consensusEngine.selectValidator();
        if (leader != null) {
            return leader;
        }
        return settings.getAutoMinerAddress().isBlank() ? null : settings.getAutoMinerAddress();
    }

    private class ProduceBlockHandler implements EventHandler<ProduceBlockEvent> {
        @Override
        public void onEvent(ProduceBlockEvent event, long sequence, boolean endOfBatch) {
            String requestedMiner = event.getMinerAddress();
            ProduceBlockEvent.Trigger trigger = event.getTrigger();
            CompletableFuture<Block> future = event.getFuture();
            long queuedMs = clock.millis() - event.getRequestedAt();
            event.clear();
            log.debug("Handling {} request for {} after {} ms in queue", trigger, requestedMiner, queuedMs);

            try {
                if (ledger.getPendingCount() == 0) {
                    emptyRounds.incrementAndGet();
                    log.debug("No pending transactions for {} request", trigger);
                    future.complete(null);
                    return;
                }

                String miner = resolveMiner(requestedMiner);
                if (miner == null) {
                    failedRounds.incrementAndGet();
                    log.warn("No eligible miner for {} request", trigger);
                    future.complete(null);
                    return;
                }

                Block block = ledger.mineBlock(miner);
                if (block == null) {
                    failedRounds.incrementAndGet();
                } else {
                    blocksProduced.incrementAndGet();
                }
                future.complete(block);
            } catch (Exception e) {
                failedRounds.incrementAndGet();
                log.error("Error producing block for {} request", trigger, e);
                future.completeExceptionally(e);
            }
        }
    }
}
