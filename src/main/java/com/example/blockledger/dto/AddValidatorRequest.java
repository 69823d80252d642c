package com.example.blockledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class AddValidatorRequest {
    @NotBlank
    private String address;
    @NotNull
    private BigDecimal stake;
}
