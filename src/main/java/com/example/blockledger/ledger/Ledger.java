package com.example.blockledger.ledger;

import com.example.blockledger.consensus.BlockValidator;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.NetworkStats;
import com.example.blockledger.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory ledger: the append-only chain plus the pending-transaction pool.
 * <p>
 * Locking:
 * <ul>
 *   <li>{@code miningLock} serializes {@link #mineBlock(String)} so drain, nonce search,
 *   validation and append run as one critical section against other miners</li>
 *   <li>{@code chainLock} guards the chain; reads share it, append takes the write side</li>
 *   <li>{@code poolLock} guards the pending pool and the known transaction ids, so
 *   submitters are not blocked while a nonce search is running</li>
 * </ul>
 */
@Slf4j
public class Ledger {

    public static final String GENESIS_PREVIOUS_HASH = "0";
    public static final String GENESIS_MINER = "genesis";

    private final LedgerSettings settings;
    private final BlockHasher blockHasher;
    private final BlockValidator blockValidator;
    private final Clock clock;

    private final List<Block> chain = new ArrayList<>();
    private final Deque<Transaction> pendingPool = new ArrayDeque<>();
    // ids that are pending or committed
    private final Set<String> knownTransactionIds = new HashSet<>();

    private final ReadWriteLock chainLock = new ReentrantReadWriteLock();
    private final Object poolLock = new Object();
    private final ReentrantLock miningLock = new ReentrantLock();

    private volatile int difficulty;

    public Ledger(LedgerSettings settings, BlockHasher blockHasher, BlockValidator blockValidator, Clock clock) {
        this.settings = settings;
        this.blockHasher = blockHasher;
        this.blockValidator = blockValidator;
        this.clock = clock;
        this.difficulty = settings.getInitialDifficulty();
        chain.add(createGenesisBlock());
        log.info("Ledger initialized: difficulty={}, reward={}, proofOfWork={}",
                difficulty, settings.getMiningReward(), blockValidator.requiresProofOfWork());
    }

    private Block createGenesisBlock() {
        Block genesis = Block.builder()
                .index(0)
                .timestamp(clock.millis())
                .transactions(List.of())
                .previousHash(GENESIS_PREVIOUS_HASH)
                .nonce(0)
                .merkleRoot(blockHasher.calculateMerkleRoot(List.of()))
                .difficulty(difficulty)
                .miner(GENESIS_MINER)
                .reward(BigDecimal.ZERO)
                .build();
        return genesis.toBuilder().hash(blockHasher.calculateHash(genesis)).build();
    }

    /**
     * Queue a transaction for the next block.
     *
     * @return false, without side effects, if the transaction is malformed or its id is already known
     */
    public boolean addTransaction(Transaction transaction) {
        if (!TransactionValidator.isWellFormed(transaction)) {
            log.debug("Rejected malformed transaction: {}", transaction);
            return false;
        }

        synchronized (poolLock) {
            if (!knownTransactionIds.add(transaction.getId())) {
                log.warn("Rejected duplicate transaction: {}", transaction.getId());
                return false;
            }
            pendingPool.addLast(transaction);
        }

        log.info("Transaction queued: {} {} -> {}, amount: {}",
                transaction.getId(), transaction.getFrom(), transaction.getTo(), transaction.getAmount());
        return true;
    }

    /**
     * Build and sign a transaction. The result is not queued.
     */
    public Transaction createTransaction(String from, String to, BigDecimal amount, String key) {
        long timestamp = clock.millis();
        BigDecimal fee = calculateTransactionFee(amount);
        long nonce = getAccountNonce(from);

        String payload = from + to + plain(amount) + fee.toPlainString() + timestamp + nonce;
        String signature = blockHasher.digest(payload + Objects.requireNonNullElse(key, ""));

        return Transaction.builder()
                .id("tx_" + UUID.randomUUID())
                .from(from)
                .to(to)
                .amount(amount)
                .fee(fee)
                .signature(signature)
                .timestamp(timestamp)
                .nonce(nonce)
                .build();
    }

    private BigDecimal calculateTransactionFee(BigDecimal amount) {
        if (amount == null) {
            return settings.getMinimumFee();
        }
        return amount.multiply(settings.getFeeRate()).max(settings.getMinimumFee());
    }

    /**
     * Drain the pool into a candidate block, search a nonce when the consensus mode needs one,
     * and commit the block if the validator accepts it.
     *
     * @return the committed block, or null when the pool is empty, the nonce search ran out of
     *         time or consensus rejected the candidate. Drained transactions are restored in the
     *         last two cases.
     */
    public Block mineBlock(String minerAddress) {
        if (minerAddress == null || minerAddress.isBlank()) {
            log.warn("Refusing to mine without a miner address");
            return null;
        }

        miningLock.lock();
        List<Transaction> drained = List.of();
        boolean committed = false;
        try {
            drained = drainPool();
            if (drained.isEmpty()) {
                return null;
            }

            Block candidate = assembleCandidate(minerAddress, drained);
            if (candidate == null) {
                return null;
            }

            if (!blockValidator.validateBlock(candidate)) {
                log.warn("Block {} from {} rejected by consensus, {} transactions returned to pool",
                        candidate.getIndex(), minerAddress, drained.size());
                return null;
            }

            if (!append(candidate)) {
                return null;
            }
            committed = true;

            blockValidator.onBlockCommitted(candidate);
            log.info("Block {} mined by {}: {} transactions, nonce={}, hash={}",
                    candidate.getIndex(), minerAddress, drained.size(), candidate.getNonce(), candidate.getHash());
            return candidate;
        } finally {
            if (!committed && !drained.isEmpty()) {
                restorePool(drained);
            }
            miningLock.unlock();
        }
    }

    private List<Transaction> drainPool() {
        synchronized (poolLock) {
            List<Transaction> drained = new ArrayList<>(pendingPool);
            pendingPool.clear();
            return drained;
        }
    }

    private void restorePool(List<Transaction> drained) {
        synchronized (poolLock) {
            // back to the head, original order first
            for (int i = drained.size() - 1; i >= 0; i--) {
                pendingPool.addFirst(drained.get(i));
            }
        }
    }

    private Block assembleCandidate(String minerAddress, List<Transaction> transactions) {
        Block latest = getLatestBlock();
        boolean proofOfWork = blockValidator.requiresProofOfWork();

        Block template = Block.builder()
                .index(latest.getIndex() + 1)
                .timestamp(clock.millis())
                .transactions(List.copyOf(transactions))
                .previousHash(latest.getHash())
                .nonce(0)
                .merkleRoot(blockHasher.calculateMerkleRoot(transactions))
                .difficulty(proofOfWork ? difficulty : 0)
                .miner(minerAddress)
                .reward(settings.getMiningReward())
                .build();

        if (!proofOfWork) {
            return template.toBuilder().hash(blockHasher.calculateHash(template)).build();
        }
        return searchNonce(template);
    }

    private Block searchNonce(Block template) {
        String target = "0".repeat(template.getDifficulty());
        String prefix = blockHasher.headerPrefix(template);
        String suffix = template.getMerkleRoot();
        long deadline = System.nanoTime() + settings.getMaxMiningDurationMs() * 1_000_000L;

        long nonce = 0;
        while (true) {
            String hash = blockHasher.digest(prefix + nonce + suffix);
            if (hash.startsWith(target)) {
                return template.toBuilder().nonce(nonce).hash(hash).build();
            }
            nonce++;
            if ((nonce & 0x3FF) == 0 && System.nanoTime() > deadline) {
                log.warn("Nonce search for block {} exhausted after {} attempts at difficulty {}",
                        template.getIndex(), nonce, template.getDifficulty());
                return null;
            }
        }
    }

    private boolean append(Block candidate) {
        chainLock.writeLock().lock();
        try {
            Block latest = chain.get(chain.size() - 1);
            if (candidate.getIndex() != chain.size() || !latest.getHash().equals(candidate.getPreviousHash())) {
                log.error("Candidate block {} does not extend chain tip {} ({})",
                        candidate.getIndex(), latest.getIndex(), latest.getHash());
                return false;
            }
            chain.add(candidate);
            adjustDifficulty();
            return true;
        } finally {
            chainLock.writeLock().unlock();
        }
    }

    // caller holds the chain write lock
    private void adjustDifficulty() {
        if (!settings.isDifficultyAdjustmentEnabled() || chain.size() < 2) {
            return;
        }

        Block latest = chain.get(chain.size() - 1);
        Block previous = chain.get(chain.size() - 2);
        long elapsed = latest.getTimestamp() - previous.getTimestamp();
        long target = settings.getTargetBlockTimeMs();

        int before = difficulty;
        if (elapsed < target / 2) {
            difficulty = Math.min(settings.getMaxDifficulty(), difficulty + 1);
        } else if (elapsed > target * 2) {
            difficulty = Math.max(settings.getMinDifficulty(), difficulty - 1);
        }
        if (before != difficulty) {
            log.info("Difficulty adjusted {} -> {} (block time {} ms, target {} ms)", before, difficulty, elapsed, target);
        }
    }

    /**
     * Validate the committed chain.
     */
    public boolean validateChain() {
        return validateChain(getChain());
    }

    /**
     * Walk the given chain from index 1, recomputing each block's hash and Merkle root and
     * checking its link to the predecessor. An empty or single-block chain is valid.
     */
    public boolean validateChain(List<Block> blocks) {
        for (int i = 1; i < blocks.size(); i++) {
            Block current = blocks.get(i);
            Block previous = blocks.get(i - 1);

            String recomputed = blockHasher.calculateHash(current);
            if (!recomputed.equals(current.getHash())) {
                log.error("Chain integrity violation: block {} hash {} does not match recomputed {}",
                        i, current.getHash(), recomputed);
                return false;
            }
            if (!blockHasher.calculateMerkleRoot(current.getTransactions()).equals(current.getMerkleRoot())) {
                log.error("Chain integrity violation: block {} Merkle root mismatch", i);
                return false;
            }
            if (!previous.getHash().equals(current.getPreviousHash())) {
                log.error("Chain integrity violation: block {} previousHash {} does not link to {}",
                        i, current.getPreviousHash(), previous.getHash());
                return false;
            }
        }
        return true;
    }

    /**
     * Replay committed blocks: incoming amounts, minus outgoing amounts and fees,
     * plus rewards of blocks mined by the address.
     */
    public BigDecimal getAccountBalance(String address) {
        BigDecimal balance = BigDecimal.ZERO;
        chainLock.readLock().lock();
        try {
            for (Block block : chain) {
                for (Transaction tx : block.getTransactions()) {
                    if (tx.getTo().equals(address)) {
                        balance = balance.add(tx.getAmount());
                    }
                    if (tx.getFrom().equals(address)) {
                        balance = balance.subtract(tx.getAmount().add(tx.getFee()));
                    }
                }
                if (address != null && address.equals(block.getMiner())) {
                    balance = balance.add(block.getReward());
                }
            }
        } finally {
            chainLock.readLock().unlock();
        }
        return balance;
    }

    public long getAccountNonce(String address) {
        long nonce = 0;
        chainLock.readLock().lock();
        try {
            for (Block block : chain) {
                for (Transaction tx : block.getTransactions()) {
                    if (tx.getFrom().equals(address)) {
                        nonce++;
                    }
                }
            }
        } finally {
            chainLock.readLock().unlock();
        }
        return nonce;
    }

    public NetworkStats getNetworkStats() {
        int pending;
        synchronized (poolLock) {
            pending = pendingPool.size();
        }

        chainLock.readLock().lock();
        try {
            Block latest = chain.get(chain.size() - 1);
            long totalTransactions = chain.stream().mapToLong(b -> b.getTransactions().size()).sum();
            // mean interval between blocks after genesis
            long averageBlockTimeMs = chain.size() > 2
                    ? (latest.getTimestamp() - chain.get(1).getTimestamp()) / (chain.size() - 2)
                    : 0;

            return NetworkStats.builder()
                    .blockHeight(latest.getIndex())
                    .chainLength(chain.size())
                    .totalTransactions(totalTransactions)
                    .pendingTransactions(pending)
                    .difficulty(difficulty)
                    .averageBlockTime(Math.round(averageBlockTimeMs / 1000.0))
                    .networkHashRate(formatHashRate())
                    .latestBlockHash(latest.getHash())
                    .build();
        } finally {
            chainLock.readLock().unlock();
        }
    }

    private String formatHashRate() {
        double hashRate = Math.pow(2, difficulty) / (settings.getTargetBlockTimeMs() / 1000.0);
        if (hashRate > 1e12) {
            return String.format("%.2f TH/s", hashRate / 1e12);
        } else if (hashRate > 1e9) {
            return String.format("%.2f GH/s", hashRate / 1e9);
        } else if (hashRate > 1e6) {
            return String.format("%.2f MH/s", hashRate / 1e6);
        }
        return String.format("%.2f KH/s", hashRate / 1e3);
    }

    public List<Block> getChain() {
        chainLock.readLock().lock();
        try {
            return List.copyOf(chain);
        } finally {
            chainLock.readLock().unlock();
        }
    }

    /**
     * The most recent {@code limit} blocks in chain order.
     */
    public List<Block> getRecentBlocks(int limit) {
        chainLock.readLock().lock();
        try {
            int from = Math.max(0, chain.size() - limit);
            return List.copyOf(chain.subList(from, chain.size()));
        } finally {
            chainLock.readLock().unlock();
        }
    }

    public Block getLatestBlock() {
        chainLock.readLock().lock();
        try {
            return chain.get(chain.size() - 1);
        } finally {
            chainLock.readLock().unlock();
        }
    }

    public int getChainLength() {
        chainLock.readLock().lock();
        try {
            return chain.size();
        } finally {
            chainLock.readLock().unlock();
        }
    }

    public List<Transaction> getPendingTransactions() {
        synchronized (poolLock) {
            return List.copyOf(pendingPool);
        }
    }

    public int getPendingCount() {
        synchronized (poolLock) {
            return pendingPool.size();
        }
    }

    public int getDifficulty() {
        return difficulty;
    }

    public String calculateHash(Block block) {
        return blockHasher.calculateHash(block);
    }

    public String calculateMerkleRoot(List<Transaction> transactions) {
        return blockHasher.calculateMerkleRoot(transactions);
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "null";
    }
}
