package com.example.blockledger.controller;

import com.example.blockledger.dto.AddValidatorRequest;
import com.example.blockledger.dto.OperationResponse;
import com.example.blockledger.dto.SlashValidatorRequest;
import com.example.blockledger.model.Validator;
import com.example.blockledger.service.ChainService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/validators")
@Tag(name = "Validator API", description = "Validator registry, leader selection and slashing")
public class ValidatorController {

    @Autowired
    private ChainService chainService;

    @GetMapping
    @Operation(summary = "List validators", description = "Registered validators with consensus statistics")
    public ResponseEntity<ChainService.ValidatorOverview> getValidators() {
        return ResponseEntity.ok(chainService.getValidators());
    }

    @GetMapping("/{address}")
    @Operation(summary = "Get validator")
    public ResponseEntity<Validator> getValidator(@PathVariable String address) {
        return chainService.getValidator(address)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/leader")
    @Operation(summary = "Select leader", description = "Stake-weighted draw among eligible validators")
    public ResponseEntity<Map<String, Object>> selectLeader() {
        String leader = chainService.selectValidator();
        Map<String, Object> response = new HashMap<>();
        response.put("leader", leader);
        response.put("timestamp", System.currentTimeMillis());
        return leader != null ? ResponseEntity.ok(response) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @PostMapping
    @Operation(summary = "Register validator", description = "Register or replace a validator; the stake must meet the minimum")
    public ResponseEntity<OperationResponse> addValidator(@Valid @RequestBody AddValidatorRequest request) {
        log.info("Registering validator {} with stake {}", request.getAddress(), request.getStake());

        if (chainService.addValidator(request.getAddress(), request.getStake())) {
            return ResponseEntity.ok(new OperationResponse(true, "Validator registered"));
        }
        return ResponseEntity.badRequest().body(new OperationResponse(false, "Validator rejected: stake below minimum"));
    }

    @PostMapping("/{address}/slash")
    @Operation(summary = "Slash validator", description = "Remove part of the stake and reputation of a validator")
    public ResponseEntity<OperationResponse> slashValidator(
            @PathVariable String address,
            @RequestBody(required = false) SlashValidatorRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "unspecified";

        if (chainService.slashValidator(address, reason)) {
            return ResponseEntity.ok(new OperationResponse(true, "Validator slashed"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new OperationResponse(false, "Validator not found"));
    }
}
