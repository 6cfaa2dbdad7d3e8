package com.netconfig.parser.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A parsed configuration: every input line in read order plus the diagnostics of the pass.
 */
@Value
@Builder
public class ConfigDocument {
    @NonNull
    List<ConfigLine> lines;

    /** The strategy actually used; never {@link ParseMode#AUTO}. */
    @NonNull
    ParseMode mode;

    @NonNull
    @Builder.Default
    ParseDiagnostics diagnostics = new ParseDiagnostics();

    /**
     * Lines without a parent, in document order.
     */
    public List<ConfigLine> getRoots() {
        return lines.stream()
                .filter(ConfigLine::isRoot)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Look up a line by its 1-based number.
     */
    public Optional<ConfigLine> getLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(lineNumber - 1));
    }

    public int size() {
        return lines.size();
    }
}
