package com.example.blockledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Validator {
    private String address;
    private BigDecimal stake;
    private int reputation;
    @JsonProperty("isActive")
    private boolean active;
    private long lastValidation;

    public Validator copy() {
        return toBuilder().build();
    }
}
