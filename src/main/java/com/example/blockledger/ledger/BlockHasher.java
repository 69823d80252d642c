package com.example.blockledger.ledger;

import com.example.blockledger.model.Block;
import com.example.blockledger.model.Transaction;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * SHA-256 hashing of blocks, transactions and Merkle roots.
 * <p>
 * A block hash covers index, timestamp, transactions, previous hash, nonce and
 * Merkle root. Difficulty, miner and reward are not part of the hash.
 */
public class BlockHasher {

    public String calculateHash(Block block) {
        return digest(headerPrefix(block) + block.getNonce() + block.getMerkleRoot());
    }

    /**
     * Pairwise Merkle root; an odd node is paired with itself and an empty list
     * hashes the empty string.
     */
    public String calculateMerkleRoot(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return digest("");
        }

        List<String> hashes = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            hashes.add(digest(canonical(tx)));
        }

        while (hashes.size() > 1) {
            List<String> next = new ArrayList<>((hashes.size() + 1) / 2);
            for (int i = 0; i < hashes.size(); i += 2) {
                String left = hashes.get(i);
                String right = i + 1 < hashes.size() ? hashes.get(i + 1) : left;
                next.add(digest(left + right));
            }
            hashes = next;
        }
        return hashes.get(0);
    }

    public String digest(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(hash.length * 2);

            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Everything that precedes the nonce in the hashed payload. The nonce search
     * computes this once per candidate.
     */
    String headerPrefix(Block block) {
        StringBuilder sb = new StringBuilder();
        sb.append(block.getIndex()).append(block.getTimestamp()).append('[');
        List<Transaction> transactions = block.getTransactions();
        if (transactions != null) {
            for (int i = 0; i < transactions.size(); i++) {
                if (i > 0) {
                    sb.append(';');
                }
                sb.append(canonical(transactions.get(i)));
            }
        }
        sb.append(']').append(block.getPreviousHash());
        return sb.toString();
    }

    String canonical(Transaction tx) {
        return String.join("|",
                tx.getId(),
                tx.getFrom(),
                tx.getTo(),
                plain(tx.getAmount()),
                plain(tx.getFee()),
                String.valueOf(tx.getTimestamp()),
                tx.getSignature(),
                String.valueOf(tx.getNonce()));
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "null";
    }
}
