package com.example.blockledger.dto;

import lombok.Data;

@Data
public class SlashValidatorRequest {
    private String reason;
}
