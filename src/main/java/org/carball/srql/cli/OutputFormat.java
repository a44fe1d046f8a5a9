package org.carball.srql.cli;

public enum OutputFormat {
    TEXT,
    JSON,
    YAML;

    public static OutputFormat fromString(String value) {
        return switch (value.toLowerCase()) {
            case "text", "txt" -> TEXT;
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("Invalid format: " + value);
        };
    }
}
