package com.netconfig.parser.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.model.ConfigDocument;
import com.netconfig.parser.model.ParseMode;
import com.netconfig.parser.parser.ConfigTreeBuilder;

/**
 * Reads configuration text from a file, a string or a list of lines and parses it.
 */
public class ConfigReader {
    private static final Logger log = LoggerFactory.getLogger(ConfigReader.class);

    private final ConfigTreeBuilder builder;

    public ConfigReader() {
        this(new ConfigTreeBuilder());
    }

    public ConfigReader(ConfigTreeBuilder builder) {
        this.builder = builder;
    }

    public ConfigDocument read(Path file) throws IOException {
        return read(file, ParseMode.AUTO);
    }

    public ConfigDocument read(Path file, ParseMode mode) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        log.info("Read {} lines from {}", lines.size(), file);
        return read(lines, mode);
    }

    public ConfigDocument read(String config) {
        return read(config, ParseMode.AUTO);
    }

    /**
     * Split on any line terminator and parse. A trailing terminator does not produce an extra empty line.
     */
    public ConfigDocument read(String config, ParseMode mode) {
        return read(splitLines(config), mode);
    }

    public ConfigDocument read(List<String> lines) {
        return read(lines, ParseMode.AUTO);
    }

    public ConfigDocument read(List<String> lines, ParseMode mode) {
        return builder.parse(lines, mode);
    }

    private static List<String> splitLines(String config) {
        String[] parts = config.split("\\R", -1);
        int length = parts.length;
        if (length > 0 && parts[length - 1].isEmpty()) {
            length--;
        }
        return Arrays.asList(parts).subList(0, length);
    }
}
