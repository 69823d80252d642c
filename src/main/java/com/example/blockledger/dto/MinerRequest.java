package com.example.blockledger.dto;

import lombok.Data;

/**
 * Miner for a block or session request. Block requests may leave it empty to let consensus
 * select the leader.
 */
@Data
public class MinerRequest {
    private String minerAddress;
}
