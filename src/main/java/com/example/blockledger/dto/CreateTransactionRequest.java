package com.example.blockledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreateTransactionRequest {
    @NotBlank
    private String from;
    @NotBlank
    private String to;
    @NotNull
    @Positive
    private BigDecimal amount;
    // signing key, mixed into the signature hash
    private String key;
}
