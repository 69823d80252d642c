package com.example.blockledger.model;

public enum ConsensusType {
    POW("pow"),
    POS("pos"),
    HYBRID("hybrid");

    private final String value;

    ConsensusType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean includesProofOfWork() {
        return this == POW || this == HYBRID;
    }

    public static ConsensusType fromValue(String value) {
        for (ConsensusType type : ConsensusType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown consensus type: " + value);
    }
}
