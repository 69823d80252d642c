package com.example.blockledger.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * A transfer request between two addresses. Immutable once created.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {
    String id;
    String from;
    String to;
    BigDecimal amount;
    BigDecimal fee;
    String signature;
    long timestamp;
    // sender's committed outgoing count when the transaction was created
    long nonce;
}
