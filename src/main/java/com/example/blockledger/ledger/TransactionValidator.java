package com.example.blockledger.ledger;

import com.example.blockledger.model.Transaction;

import java.math.BigDecimal;

/**
 * Structural transaction checks shared by the ledger pool and block validation.
 * Signatures are checked for presence and length only.
 */
public final class TransactionValidator {

    public static final int SIGNATURE_LENGTH = 64;

    private TransactionValidator() {
    }

    public static boolean isWellFormed(Transaction tx) {
        if (tx == null) {
            return false;
        }
        if (isBlank(tx.getId()) || isBlank(tx.getFrom()) || isBlank(tx.getTo())) {
            return false;
        }
        if (tx.getAmount() == null || tx.getAmount().signum() <= 0) {
            return false;
        }
        if (tx.getFee() == null || tx.getFee().compareTo(BigDecimal.ZERO) < 0) {
            return false;
        }
        return tx.getSignature() != null && tx.getSignature().length() == SIGNATURE_LENGTH;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
