package com.agentrelay.router;

public record Classification(String label, double confidence) {

    public static final String UNKNOWN = "unknown";

    public static Classification unknown() {
        return new Classification(UNKNOWN, 0.0);
    }
}
