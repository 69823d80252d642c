package com.example.blockledger.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * An ordered batch of transactions linked to its predecessor by hash.
 * Blocks are immutable; a mined variant is derived through {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Block {
    long index;
    long timestamp;
    List<Transaction> transactions;
    String previousHash;
    String hash;
    long nonce;
    String merkleRoot;
    int difficulty;
    String miner;
    BigDecimal reward;
}
