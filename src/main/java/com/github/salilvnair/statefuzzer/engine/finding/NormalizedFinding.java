package com.github.salilvnair.statefuzzer.engine.finding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Tool-independent finding consumed by the reporting pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedFinding {
    private String tool;
    private String title;
    private String description;
    private String severity;
    private String category;
    private String filePath;
    private String lineNumber;
    private String function;
    private String toolVersion;
    private String inputSeed;
    private Map<String, Object> coverage;
    private Map<String, Object> assertions;
    private Map<String, Object> raw;
}
