package com.github.salilvnair.statefuzzer.engine.model;

/**
 * Outcome shape shared with the external tool runners of the scan pipeline.
 */
public record ToolResult(
        boolean success,
        String output,
        String error,
        Double durationSeconds
) {
    public static ToolResult failure(String error) {
        return new ToolResult(false, "", error, null);
    }
}
