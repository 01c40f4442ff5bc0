package io.trading.monitor.command;

/**
 * Severity of a console report.
 */
public enum Severity {
    INFO("INFO"),
    SUCCESS("OK"),
    WARNING("WARN"),
    ERROR("ERROR");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
