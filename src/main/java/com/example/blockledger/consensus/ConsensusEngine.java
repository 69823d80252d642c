package com.example.blockledger.consensus;

import com.example.blockledger.ledger.BlockHasher;
import com.example.blockledger.ledger.TransactionValidator;
import com.example.blockledger.model.Block;
import com.example.blockledger.model.ConsensusStats;
import com.example.blockledger.model.ConsensusType;
import com.example.blockledger.model.Transaction;
import com.example.blockledger.model.Validator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Validator registry and block acceptance rules.
 * <p>
 * The proof-of-stake check accepts a miner whose share of the active stake exceeds a fixed
 * threshold. It is a simplified stand-in for leader election, not a verifiable lottery.
 */
@Slf4j
public class ConsensusEngine implements BlockValidator {

    // maximum fractional digits kept on a slashed stake
    static final int STAKE_SCALE = 8;

    private final ConsensusSettings settings;
    private final BlockHasher blockHasher;
    private final Clock clock;
    private final Random random;

    // registration order drives leader selection
    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    public ConsensusEngine(ConsensusSettings settings, BlockHasher blockHasher, Clock clock, Random random) {
        this.settings = settings;
        this.blockHasher = blockHasher;
        this.clock = clock;
        this.random = random;
        log.info("ConsensusEngine initialized: type={}, minimumStake={}, slashingPenalty={}",
                settings.getConsensusType().getValue(), settings.getMinimumStake(), settings.getSlashingPenalty());
    }

    @Override
    public boolean validateBlock(Block block) {
        try {
            if (!validateBlockStructure(block)) {
                return false;
            }

            switch (settings.getConsensusType()) {
                case POW:
                    return validateProofOfWork(block);
                case POS:
                    return validateProofOfStake(block);
                case HYBRID:
                    return validateHybridConsensus(block);
                default:
                    return false;
            }
        } catch (RuntimeException e) {
            log.error("Block validation error for block {}", block != null ? block.getIndex() : null, e);
            return false;
        }
    }

    @Override
    public boolean requiresProofOfWork() {
        return settings.getConsensusType().includesProofOfWork();
    }

    private boolean validateBlockStructure(Block block) {
        if (block == null || isBlank(block.getHash()) || isBlank(block.getPreviousHash()) || block.getIndex() < 0) {
            log.debug("Block failed structural check: {}", block);
            return false;
        }

        long now = clock.millis();
        if (block.getTimestamp() > now + settings.getMaxFutureDriftMs()
                || block.getTimestamp() < now - settings.getMaxPastDriftMs()) {
            log.debug("Block {} timestamp {} outside accepted window around {}", block.getIndex(), block.getTimestamp(), now);
            return false;
        }

        if (block.getTransactions() == null) {
            return false;
        }
        for (Transaction tx : block.getTransactions()) {
            if (!TransactionValidator.isWellFormed(tx)) {
                log.debug("Block {} carries malformed transaction {}", block.getIndex(), tx);
                return false;
            }
        }
        return true;
    }

    /**
     * The stored hash must match the recomputed one and start with {@code difficulty} zeros.
     */
    public boolean validateProofOfWork(Block block) {
        if (block.getDifficulty() < 0) {
            return false;
        }
        String hash = blockHasher.calculateHash(block);
        boolean valid = hash.equals(block.getHash()) && hash.startsWith("0".repeat(block.getDifficulty()));
        if (!valid) {
            log.debug("Block {} failed proof of work at difficulty {}", block.getIndex(), block.getDifficulty());
        }
        return valid;
    }

    /**
     * The miner must be an active validator holding at least the minimum stake, with a
     * share of the active stake above the selection threshold.
     */
    public boolean validateProofOfStake(Block block) {
        registryLock.readLock().lock();
        try {
            Validator validator = validators.get(block.getMiner());
            if (validator == null || !validator.isActive()) {
                log.debug("Block {} miner {} is not an active validator", block.getIndex(), block.getMiner());
                return false;
            }
            if (validator.getStake().compareTo(settings.getMinimumStake()) < 0) {
                return false;
            }

            BigDecimal totalStake = totalActiveStake();
            if (totalStake.signum() <= 0) {
                return false;
            }
            BigDecimal selectionProbability = validator.getStake().divide(totalStake, MathContext.DECIMAL64);
            boolean selected = selectionProbability.compareTo(settings.getSelectionThreshold()) > 0;
            if (!selected) {
                log.debug("Block {} miner {} stake share {} below threshold {}",
                        block.getIndex(), block.getMiner(), selectionProbability, settings.getSelectionThreshold());
            }
            return selected;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private boolean validateHybridConsensus(Block block) {
        boolean powValid = validateProofOfWork(block);
        boolean posValid = validateProofOfStake(block);
        return powValid && posValid;
    }

    /**
     * Stake-weighted roulette over active validators that meet the minimum stake.
     *
     * @return the selected address, or null when no validator qualifies
     */
    public String selectValidator() {
        registryLock.readLock().lock();
        try {
            List<Validator> eligible = new ArrayList<>();
            BigDecimal totalStake = BigDecimal.ZERO;
            for (Validator v : validators.values()) {
                if (v.isActive() && v.getStake().compareTo(settings.getMinimumStake()) >= 0) {
                    eligible.add(v);
                    totalStake = totalStake.add(v.getStake());
                }
            }

            if (eligible.isEmpty()) {
                return null;
            }

            BigDecimal remaining = totalStake.multiply(BigDecimal.valueOf(random.nextDouble()));
            for (Validator v : eligible) {
                remaining = remaining.subtract(v.getStake());
                if (remaining.signum() <= 0) {
                    return v.getAddress();
                }
            }
            return eligible.get(0).getAddress();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Register or replace a validator.
     *
     * @return false when the address is blank or the stake is below the minimum
     */
    public boolean addValidator(String address, BigDecimal stake) {
        if (isBlank(address) || stake == null || stake.compareTo(settings.getMinimumStake()) < 0) {
            log.warn("Validator registration rejected: address={}, stake={}, minimumStake={}",
                    address, stake, settings.getMinimumStake());
            return false;
        }

        Validator validator = Validator.builder()
                .address(address)
                .stake(stake)
                .reputation(settings.getInitialReputation())
                .active(true)
                .lastValidation(clock.millis())
                .build();

        registryLock.writeLock().lock();
        try {
            Validator previous = validators.put(address, validator);
            if (previous != null) {
                log.info("Validator {} re-registered: stake {} -> {}", address, previous.getStake(), stake);
            } else {
                log.info("Validator {} registered with stake {}", address, stake);
            }
        } finally {
            registryLock.writeLock().unlock();
        }
        return true;
    }

    /**
     * Deduct the slashing penalty from the validator's stake and reputation, deactivating it
     * when the stake falls below the minimum.
     *
     * @return false when the address is not registered
     */
    public boolean slashValidator(String address, String reason) {
        registryLock.writeLock().lock();
        try {
            Validator validator = validators.get(address);
            if (validator == null) {
                log.warn("Cannot slash unknown validator {}", address);
                return false;
            }

            BigDecimal penalty = validator.getStake().multiply(settings.getSlashingPenalty());
            BigDecimal stake = validator.getStake().subtract(penalty).max(BigDecimal.ZERO);
            if (stake.scale() > STAKE_SCALE) {
                stake = stake.setScale(STAKE_SCALE, RoundingMode.HALF_EVEN);
            }
            validator.setStake(stake);
            validator.setReputation(Math.max(0, validator.getReputation() - settings.getReputationPenalty()));

            log.warn("Validator {} slashed: {} for {}", address, penalty, reason);
            if (validator.isActive() && validator.getStake().compareTo(settings.getMinimumStake()) < 0) {
                validator.setActive(false);
                log.warn("Validator {} deactivated: stake {} below minimum {}",
                        address, validator.getStake(), settings.getMinimumStake());
            }
            return true;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    @Override
    public void onBlockCommitted(Block block) {
        registryLock.writeLock().lock();
        try {
            Validator validator = validators.get(block.getMiner());
            if (validator != null) {
                validator.setLastValidation(block.getTimestamp());
            }
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    public List<Validator> getValidators() {
        registryLock.readLock().lock();
        try {
            List<Validator> copies = new ArrayList<>(validators.size());
            for (Validator v : validators.values()) {
                copies.add(v.copy());
            }
            return copies;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public Optional<Validator> getValidator(String address) {
        registryLock.readLock().lock();
        try {
            return Optional.ofNullable(validators.get(address)).map(Validator::copy);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public ConsensusStats getConsensusStats() {
        registryLock.readLock().lock();
        try {
            int active = 0;
            long reputationSum = 0;
            for (Validator v : validators.values()) {
                if (v.isActive()) {
                    active++;
                    reputationSum += v.getReputation();
                }
            }

            return ConsensusStats.builder()
                    .consensusType(settings.getConsensusType().getValue())
                    .totalValidators(validators.size())
                    .activeValidators(active)
                    .totalStake(totalActiveStake())
                    .minimumStake(settings.getMinimumStake())
                    .averageReputation(active > 0 ? (double) reputationSum / active : 0)
                    .build();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public ConsensusType getConsensusType() {
        return settings.getConsensusType();
    }

    // caller holds the registry lock
    private BigDecimal totalActiveStake() {
        BigDecimal total = BigDecimal.ZERO;
        for (Validator v : validators.values()) {
            if (v.isActive()) {
                total = total.add(v.getStake());
            }
        }
        return total;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
