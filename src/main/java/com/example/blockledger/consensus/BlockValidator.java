package com.example.blockledger.consensus;

import com.example.blockledger.model.Block;

/**
 * Acceptance rules the ledger consults before committing a mined block.
 */
public interface BlockValidator {

    /**
     * @return true when the candidate may be appended to the chain
     */
    boolean validateBlock(Block block);

    /**
     * Whether candidates need a proof-of-work nonce before validation.
     */
    boolean requiresProofOfWork();

    /**
     * Called after the block has been appended.
     */
    default void onBlockCommitted(Block block) {
    }
}
