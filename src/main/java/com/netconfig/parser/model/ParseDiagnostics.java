package com.netconfig.parser.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Structural anomalies collected while building one document.
 *
 * Pure structure only: the parsers do the logging.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
