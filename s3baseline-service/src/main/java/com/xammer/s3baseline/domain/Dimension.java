package com.xammer.s3baseline.domain;

public enum Dimension {
    POLICY("Deny insecure transport policy"),
    LOGGING("Server access logging");

    private final String label;

    Dimension(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
