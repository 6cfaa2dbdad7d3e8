package com.netconfig.parser.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.model.ConfigDocument;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.ParseMode;

import lombok.NonNull;

/**
 * Entry point for building a line tree from raw configuration text.
 */
public class ConfigTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(ConfigTreeBuilder.class);

    private final ParserConfig config;
    private final ParseModeDetector detector;

    public ConfigTreeBuilder() {
        this(ParserConfig.defaults());
    }

    public ConfigTreeBuilder(@NonNull ParserConfig config) {
        this.config = config;
        this.detector = new ParseModeDetector(config);
    }

    /**
     * Parse the lines and return every line in read order. Index {@code i} holds line {@code i + 1}.
     */
    public List<ConfigLine> build(List<String> lines, ParseMode mode) {
        return parse(lines, mode).getLines();
    }

    /**
     * Parse the lines into a document, resolving {@link ParseMode#AUTO} first.
     */
    public ConfigDocument parse(@NonNull List<String> lines, @NonNull ParseMode mode) {
        ParseMode resolved = mode == ParseMode.AUTO ? detector.detect(lines) : mode;
        log.debug("Parsing {} lines as {}", lines.size(), resolved);
        return parserFor(lines, resolved).parse();
    }

    private ConfigLineParser parserFor(List<String> lines, ParseMode mode) {
        return switch (mode) {
            case BRACED -> new BracedParser(lines, config);
            case INDENTATION, AUTO -> new IndentationParser(lines);
        };
    }
}
